package org.oldskooler.computedhash;

import org.junit.jupiter.api.Test;
import org.oldskooler.computedhash.contexts.ArticlesContext;
import org.oldskooler.computedhash.contexts.DocumentsContext;
import org.oldskooler.computedhash.contexts.EmptyContext;
import org.oldskooler.computedhash.contexts.PlainDocumentsContext;
import org.oldskooler.computedhash.contexts.RehashedDocumentsContext;
import org.oldskooler.computedhash.models.Article;
import org.oldskooler.computedhash.models.Document;
import org.oldskooler.computedhash.operations.model.AlterColumnOperation;
import org.oldskooler.computedhash.operations.model.CreateTableOperation;
import org.oldskooler.computedhash.operations.model.MigrationOperation;
import org.oldskooler.computedhash.snapshot.ModelSnapshot;
import org.oldskooler.computedhash.snapshot.ModelSnapshotSerializer;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Model revisions of the Documents table, migrated one after another.
 */
class MigrationScenarioTest {

    private static final String CONTENT_HASH_512 =
            "HASHBYTES('SHA2_512', ISNULL(CONVERT(NVARCHAR(MAX), [Title]), N'') + '|' + "
                    + "ISNULL(CONVERT(NVARCHAR(MAX), [Content]), N'')) PERSISTED";
    private static final String CONTENT_HASH_256 =
            "HASHBYTES('SHA2_256', ISNULL(CONVERT(NVARCHAR(MAX), [Title]), N'') + '|' + "
                    + "ISNULL(CONVERT(NVARCHAR(MAX), [Content]), N'')) PERSISTED";

    private final ModelSnapshotSerializer serializer = new ModelSnapshotSerializer();

    /** Stores and reloads the snapshot the way a migration history would. */
    private ModelSnapshot stored(ModelContext context) {
        return serializer.fromJson(serializer.toJson(context.snapshot()));
    }

    @Test
    void testInitialMigrationCreatesComputedColumns() {
        ModelContext context = new DocumentsContext();

        List<MigrationOperation> ops = context.migrations().operations(ModelSnapshot.empty());
        assertThat(ops).hasSize(1).first().isInstanceOf(CreateTableOperation.class);

        List<String> sql = context.migrations().generateSql(ops);
        assertThat(sql).hasSize(1);
        assertThat(sql.get(0))
                .startsWith("CREATE TABLE [Documents] (")
                .contains("[Id] INT IDENTITY(1,1) NOT NULL")
                .contains("[Title] NVARCHAR(200) NOT NULL")
                .contains("[Content] NVARCHAR(MAX)")
                .contains("[ContentHash] AS " + CONTENT_HASH_512)
                .contains("[VersionHash] AS HASHBYTES('SHA2_256', ISNULL(CONVERT(NVARCHAR(MAX), [Content]), N'') + '|' + "
                        + "ISNULL(CONVERT(NVARCHAR(MAX), [LastModified]), N'')) PERSISTED")
                .contains("PRIMARY KEY ([Id])")
                .doesNotContain("PERSISTED PERSISTED");
    }

    @Test
    void testCreateTableSqlMatchesInitialMigration() {
        ModelContext context = new DocumentsContext();

        assertThat(context.migrations().createTableSql(Document.class))
                .isEqualTo(context.migrations().migrationSql(ModelSnapshot.empty()).get(0));
    }

    @Test
    void testAlgorithmChangeReplacesColumn() {
        ModelSnapshot previous = stored(new DocumentsContext());
        ModelContext next = new RehashedDocumentsContext();

        List<MigrationOperation> ops = next.migrations().operations(previous);
        assertThat(ops).hasSize(1);
        AlterColumnOperation alter = (AlterColumnOperation) ops.get(0);
        assertThat(alter.getName()).isEqualTo("ContentHash");
        assertThat(alter.getOldColumn().effectiveType()).isEqualTo("BINARY(64)");
        assertThat(alter.getColumnType()).isEqualTo("BINARY(32)");

        assertThat(next.migrations().generateSql(ops)).containsExactly(
                "ALTER TABLE [Documents] DROP COLUMN [ContentHash]",
                "ALTER TABLE [Documents] ADD [ContentHash] AS " + CONTENT_HASH_256);
    }

    @Test
    void testRemovingDeclarationMakesPlainColumn() {
        ModelSnapshot previous = stored(new DocumentsContext());
        ModelContext next = new PlainDocumentsContext();

        List<MigrationOperation> ops = next.migrations().operations(previous);
        assertThat(ops).hasSize(1);
        AlterColumnOperation alter = (AlterColumnOperation) ops.get(0);
        assertThat(alter.isComputed()).isFalse();
        assertThat(alter.isStored()).isFalse();

        assertThat(next.migrations().generateSql(ops)).containsExactly(
                "ALTER TABLE [Documents] DROP COLUMN [ContentHash]",
                "ALTER TABLE [Documents] ADD [ContentHash] BINARY(64) NULL");
    }

    @Test
    void testReapplyingDeclarationMakesComputedColumnAgain() {
        ModelSnapshot previous = stored(new PlainDocumentsContext());
        ModelContext next = new DocumentsContext();

        assertThat(next.migrations().migrationSql(previous)).containsExactly(
                "ALTER TABLE [Documents] DROP COLUMN [ContentHash]",
                "ALTER TABLE [Documents] ADD [ContentHash] AS " + CONTENT_HASH_512);
    }

    @Test
    void testUnchangedModelProducesNoOperations() {
        assertThat(new DocumentsContext().migrations().operations(stored(new DocumentsContext()))).isEmpty();
        assertThat(new RehashedDocumentsContext().migrations().operations(stored(new RehashedDocumentsContext()))).isEmpty();
        assertThat(new PlainDocumentsContext().migrations().operations(stored(new PlainDocumentsContext()))).isEmpty();
    }

    @Test
    void testDroppingTheEntityDropsTheTable() {
        ModelSnapshot previous = stored(new DocumentsContext());

        assertThat(new EmptyContext().migrations().migrationSql(previous))
                .containsExactly("DROP TABLE [Documents]");
    }

    @Test
    void testFluentOnlyEntity() {
        ModelContext context = new ArticlesContext();

        assertThat(context.migrations().createTableSql(Article.class))
                .contains("[Id] BIGINT IDENTITY(1,1) NOT NULL")
                .contains("[ContentHash] AS HASHBYTES('SHA1', ISNULL(CONVERT(NVARCHAR(MAX), [Title]), N'') + '|' + "
                        + "ISNULL(CONVERT(NVARCHAR(MAX), [Author]), N'')) PERSISTED");
        assertThat(context.migrations().dropTableSql(Article.class)).isEqualTo("DROP TABLE [Articles]");
    }

    @Test
    void testUnregisteredEntityIsRejected() {
        assertThatThrownBy(() -> new EmptyContext().tableMeta(Document.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(Document.class.getName());
    }

    @Test
    void testContextReadsOptionsFromClasspath() {
        ModelContext context = new DocumentsContext();

        assertThat(context.options().isWarnOnInsecureAlgorithms()).isFalse();
        assertThat(context.options().isSuppressNoOpAlters()).isTrue();
    }
}
