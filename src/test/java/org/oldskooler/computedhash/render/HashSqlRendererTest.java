package org.oldskooler.computedhash.render;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.oldskooler.computedhash.algorithm.HashAlgorithm;
import org.oldskooler.computedhash.descriptor.ComputedHashDescriptor;
import org.oldskooler.computedhash.descriptor.DescriptorNormalizer;
import org.oldskooler.computedhash.descriptor.HashDeclaration;
import org.oldskooler.computedhash.error.ComputedHashException;
import org.oldskooler.computedhash.error.Violation;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class HashSqlRendererTest {

    private final HashSqlRenderer renderer = new HashSqlRenderer();

    private static ComputedHashDescriptor descriptor(String algorithm, String... sources) {
        return new DescriptorNormalizer().normalize(HashDeclaration.builder()
                .owner("Documents")
                .targetColumn("ContentHash")
                .targetType(byte[].class)
                .algorithmToken(algorithm)
                .sourceNames(Arrays.asList(sources))
                .build());
    }

    @ParameterizedTest
    @EnumSource(HashAlgorithm.class)
    void testStorageTypeMatchesAlgorithmWidth(HashAlgorithm algorithm) {
        ComputedHashDescriptor d = descriptor(algorithm.name(), "Title");

        assertThat(renderer.renderStorageType(d).getWidth()).isEqualTo(algorithm.width());
        assertThat(renderer.renderStorageType(d).toSql()).isEqualTo(algorithm.recommendedSqlType());
        assertThat(renderer.renderHashExpression(d)).startsWith("HASHBYTES('" + algorithm.name() + "', ");
    }

    @Test
    void testRenderExpressionSingleSource() {
        ComputedHashDescriptor d = descriptor("SHA2_256", "Title");

        assertThat(renderer.renderExpression(d))
                .isEqualTo("HASHBYTES('SHA2_256', ISNULL(CONVERT(NVARCHAR(MAX), [Title]), N'')) PERSISTED");
    }

    @Test
    void testRenderExpressionJoinsSourcesInOrder() {
        ComputedHashDescriptor d = descriptor("sha2_512", "Title", "Content");

        assertThat(renderer.renderExpression(d)).isEqualTo(
                "HASHBYTES('SHA2_512', ISNULL(CONVERT(NVARCHAR(MAX), [Title]), N'') + '|' + "
                        + "ISNULL(CONVERT(NVARCHAR(MAX), [Content]), N'')) PERSISTED");
        assertThat(renderer.renderStorageType(d).toSql()).isEqualTo("BINARY(64)");
    }

    @Test
    void testRenderingIsDeterministic() {
        assertThat(renderer.renderExpression(descriptor("SHA2_256", "A", "B", "C")))
                .isEqualTo(renderer.renderExpression(descriptor("sha2_256", "A", "B", "C")));
    }

    @Test
    void testSourceOrderChangesExpression() {
        assertThat(renderer.renderExpression(descriptor("SHA2_256", "A", "B")))
                .isNotEqualTo(renderer.renderExpression(descriptor("SHA2_256", "B", "A")));
    }

    @Test
    void testSourceNamesAreQuoted() {
        assertThat(renderer.renderHashExpression(descriptor("MD5", "Odd]Name")))
                .contains("[Odd]]Name]");
    }

    @Test
    void testCheckStorageTypeAcceptsMatchingOrMissingType() {
        ComputedHashDescriptor d = descriptor("SHA2_256", "Title");

        assertThatCode(() -> renderer.checkStorageType(null, d, "Documents.ContentHash")).doesNotThrowAnyException();
        assertThatCode(() -> renderer.checkStorageType("  ", d, "Documents.ContentHash")).doesNotThrowAnyException();
        assertThatCode(() -> renderer.checkStorageType("binary ( 32 )", d, "Documents.ContentHash")).doesNotThrowAnyException();
    }

    @Test
    void testCheckStorageTypeRejectsWrongWidth() {
        ComputedHashDescriptor d = descriptor("SHA2_256", "Title");

        assertThatThrownBy(() -> renderer.checkStorageType("BINARY(64)", d, "Documents.ContentHash"))
                .isInstanceOf(ComputedHashException.class)
                .hasMessage("Documents.ContentHash: computed hash columns must use a BINARY storage type. "
                        + "Found: BINARY(64). For algorithm 'SHA2_256', use BINARY(32)");
    }

    @Test
    void testCheckStorageTypeRejectsNonBinary() {
        ComputedHashDescriptor d = descriptor("SHA1", "Title");

        assertThatThrownBy(() -> renderer.checkStorageType("nvarchar(64)", d, "Documents.ContentHash"))
                .isInstanceOf(ComputedHashException.class)
                .hasMessageContaining("Found: NVARCHAR(64)")
                .hasMessageContaining("use BINARY(20)")
                .extracting(e -> ((ComputedHashException) e).getViolation())
                .isEqualTo(Violation.INCOMPATIBLE_STORAGE_TYPE);
    }

    @Test
    void testVarbinaryIsNotAccepted() {
        ComputedHashDescriptor d = descriptor("SHA2_256", "Title");

        assertThatThrownBy(() -> renderer.checkStorageType("VARBINARY(32)", d, "Documents.ContentHash"))
                .isInstanceOf(ComputedHashException.class);
    }
}
