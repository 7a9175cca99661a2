package org.oldskooler.computedhash.operations;

import org.junit.jupiter.api.Test;
import org.oldskooler.computedhash.config.ComputedHashOptions;
import org.oldskooler.computedhash.descriptor.DescriptorNormalizer;
import org.oldskooler.computedhash.descriptor.HashDeclaration;
import org.oldskooler.computedhash.error.ComputedHashException;
import org.oldskooler.computedhash.error.Violation;
import org.oldskooler.computedhash.mapping.AnnotationKeys;
import org.oldskooler.computedhash.mapping.ComputedHashAnnotations;
import org.oldskooler.computedhash.operations.model.AddColumnOperation;
import org.oldskooler.computedhash.operations.model.AlterColumnOperation;
import org.oldskooler.computedhash.operations.model.ColumnState;
import org.oldskooler.computedhash.operations.model.CreateTableOperation;
import org.oldskooler.computedhash.operations.model.DropColumnOperation;
import org.oldskooler.computedhash.operations.model.DropTableOperation;
import org.oldskooler.computedhash.operations.model.MigrationOperation;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ComputedHashOperationRewriterTest {

    private final ComputedHashOperationRewriter rewriter = new ComputedHashOperationRewriter();

    private static Map<String, Object> hash(String algorithm, String... sources) {
        Map<String, Object> a = new LinkedHashMap<>();
        ComputedHashAnnotations.encode(new DescriptorNormalizer().normalize(HashDeclaration.builder()
                .owner("Documents")
                .targetColumn("ContentHash")
                .targetType(byte[].class)
                .algorithmToken(algorithm)
                .sourceNames(Arrays.asList(sources))
                .build()), a);
        return a;
    }

    private static AlterColumnOperation alter(ColumnState old, Map<String, Object> annotations) {
        AlterColumnOperation op = new AlterColumnOperation("Documents", "ContentHash", old);
        op.setStoreType(old.getStoreType());
        op.setColumnType(old.getColumnType());
        op.setComputedColumnSql(old.getComputedColumnSql());
        op.setStored(old.isStored());
        op.getAnnotations().putAll(annotations);
        return op;
    }

    @Test
    void testAddColumnGetsComputedPayload() {
        AddColumnOperation add = new AddColumnOperation("Documents", "ContentHash");
        add.setStoreType("VARBINARY(MAX)");
        add.getAnnotations().putAll(hash("SHA2_256", "Title", "Content"));

        List<MigrationOperation> out = rewriter.rewrite(List.of(add));

        assertThat(out).containsExactly(add);
        assertThat(add.getColumnType()).isEqualTo("BINARY(32)");
        assertThat(add.isStored()).isTrue();
        assertThat(add.getComputedColumnSql()).startsWith("HASHBYTES('SHA2_256', ");
    }

    @Test
    void testCreateTableColumnsAreRewritten() {
        CreateTableOperation create = new CreateTableOperation("Documents");
        AddColumnOperation title = new AddColumnOperation("Documents", "Title");
        title.setStoreType("NVARCHAR(200)");
        AddColumnOperation hashColumn = new AddColumnOperation("Documents", "ContentHash");
        hashColumn.getAnnotations().putAll(hash("MD5", "Title"));
        create.getColumns().add(title);
        create.getColumns().add(hashColumn);

        rewriter.rewrite(List.of(create));

        assertThat(title.getComputedColumnSql()).isNull();
        assertThat(title.getColumnType()).isNull();
        assertThat(hashColumn.getColumnType()).isEqualTo("BINARY(16)");
        assertThat(hashColumn.isComputed()).isTrue();
    }

    @Test
    void testAlgorithmChangeRewritesAlter() {
        ColumnState old = ColumnState.builder()
                .storeType("BINARY(64)")
                .computedColumnSql("old sql")
                .stored(true)
                .annotations(hash("SHA2_512", "Title", "Content"))
                .build();
        AlterColumnOperation op = alter(old, hash("SHA2_256", "Title", "Content"));

        List<MigrationOperation> out = rewriter.rewrite(List.of(op));

        assertThat(out).containsExactly(op);
        assertThat(op.getColumnType()).isEqualTo("BINARY(32)");
        assertThat(op.getComputedColumnSql()).contains("HASHBYTES('SHA2_256', ");
        assertThat(op.getOldColumn().effectiveType()).isEqualTo("BINARY(64)");
    }

    @Test
    void testRemovalConvertsToPlain() {
        ColumnState old = ColumnState.builder()
                .storeType("BINARY(64)")
                .computedColumnSql("old sql")
                .stored(true)
                .annotations(hash("SHA2_512", "Title"))
                .build();
        AlterColumnOperation op = new AlterColumnOperation("Documents", "ContentHash", old);
        op.setStoreType("VARBINARY(MAX)");

        rewriter.rewrite(List.of(op));

        assertThat(op.isComputed()).isFalse();
        assertThat(op.isStored()).isFalse();
        assertThat(op.getColumnType()).isEqualTo("BINARY(64)");
    }

    @Test
    void testUnchangedHashIsSuppressed() {
        Map<String, Object> annotations = hash("SHA2_256", "Title");
        ColumnState old = ColumnState.builder()
                .storeType("BINARY(32)")
                .computedColumnSql("same")
                .stored(true)
                .annotations(annotations)
                .build();
        Map<String, Object> respelled = new LinkedHashMap<>(annotations);
        respelled.put(AnnotationKeys.IS_COMPUTED_HASH, "true");

        assertThat(rewriter.rewrite(List.of(alter(old, respelled)))).isEmpty();
    }

    @Test
    void testUnchangedHashKeptWhenSuppressionDisabled() {
        ComputedHashOperationRewriter keepAll = new ComputedHashOperationRewriter(new TransitionResolver(),
                ComputedHashOptions.builder().suppressNoOpAlters(false).build());
        Map<String, Object> annotations = hash("SHA2_256", "Title");
        ColumnState old = ColumnState.builder()
                .storeType("BINARY(32)")
                .computedColumnSql("same")
                .stored(true)
                .annotations(annotations)
                .build();
        AlterColumnOperation op = alter(old, annotations);

        assertThat(keepAll.rewrite(List.of(op))).containsExactly(op);
        assertThat(op.getComputedColumnSql()).isEqualTo("same");
    }

    @Test
    void testUnchangedHashWithNullabilityChangeIsKept() {
        Map<String, Object> annotations = hash("SHA2_256", "Title");
        ColumnState old = ColumnState.builder()
                .storeType("BINARY(32)")
                .computedColumnSql("same")
                .stored(true)
                .annotations(annotations)
                .build();
        AlterColumnOperation op = alter(old, annotations);
        op.setNullable(false);

        assertThat(rewriter.rewrite(List.of(op))).containsExactly(op);
        assertThat(op.getComputedColumnSql()).isEqualTo("same");
    }

    @Test
    void testUntrackedOperationsPassThrough() {
        AlterColumnOperation title = new AlterColumnOperation("Documents", "Title",
                ColumnState.builder().storeType("NVARCHAR(100)").build());
        title.setStoreType("NVARCHAR(200)");
        DropTableOperation dropTable = new DropTableOperation("Legacy");
        DropColumnOperation dropColumn = new DropColumnOperation("Documents", "ContentHash");
        dropColumn.getOldAnnotations().putAll(hash("SHA2_256", "Title"));

        List<MigrationOperation> out = rewriter.rewrite(List.of(title, dropTable, dropColumn));

        assertThat(out).containsExactly(title, dropTable, dropColumn);
        assertThat(title.getColumnType()).isNull();
        assertThat(title.getComputedColumnSql()).isNull();
    }

    @Test
    void testMalformedAnnotationsFailWithColumnName() {
        AddColumnOperation add = new AddColumnOperation("Documents", "ContentHash");
        add.getAnnotations().put(AnnotationKeys.IS_COMPUTED_HASH, true);
        add.getAnnotations().put(AnnotationKeys.SOURCE_PROPERTIES, "Title");

        assertThatThrownBy(() -> rewriter.rewrite(List.of(add)))
                .isInstanceOf(ComputedHashException.class)
                .hasMessageStartingWith("Documents.ContentHash: ")
                .extracting(e -> ((ComputedHashException) e).getViolation())
                .isEqualTo(Violation.MALFORMED_ANNOTATION_STATE);
    }

    @Test
    void testDroppedColumnWithMalformedStateFails() {
        DropColumnOperation drop = new DropColumnOperation("Documents", "ContentHash");
        drop.getOldAnnotations().put(AnnotationKeys.ALGORITHM, "SHA2_256");

        assertThatThrownBy(() -> rewriter.rewrite(List.of(drop)))
                .isInstanceOf(ComputedHashException.class);
    }
}
