package xml.java17.xmlmap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XmlSchemasTest extends XmlMapTestBase {

    @BeforeEach
    void clearCache() {
        XmlSchemas.clear();
    }

    @Test
    void compiledSchemaIsCached() {
        final var location = resource("book.xsd");
        final var first = XmlSchemas.load(location);
        assertThat(XmlSchemas.load(location)).isSameAs(first);
        assertThat(XmlSchemas.cachedLocations()).containsExactly(location);
    }

    @Test
    void validDocumentHasNoErrors() {
        final var result = XmlSchemas.validate(XmlDocuments.parse("<book><title>T</title></book>"),
                resource("book.xsd"));
        assertThat(result.isValid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void collectsEveryError() {
        final var result = XmlSchemas.validate(XmlDocuments.parse("<book year=\"x\"><chapter/></book>"),
                resource("book.xsd"));
        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).hasSizeGreaterThanOrEqualTo(2);
    }

    @Test
    void unreadableSchemaFails(@TempDir Path dir) throws IOException {
        final var broken = dir.resolve("broken.xsd");
        Files.writeString(broken, "<xs:schema xmlns:xs=\"http://www.w3.org/2001/XMLSchema\">");
        assertThatThrownBy(() -> XmlSchemas.load(broken.toString()))
                .isInstanceOf(XmlMapException.class)
                .hasMessageContaining("Failed to load XSD schema");
        assertThat(XmlSchemas.cachedLocations()).isEmpty();
    }

    @Test
    void validationResultCopiesErrors() {
        final var errors = new java.util.ArrayList<String>();
        errors.add("1:1: bad");
        final var result = XmlValidationResult.failure(errors);
        errors.clear();
        assertThat(result.errors()).containsExactly("1:1: bad");
        assertThat(XmlValidationResult.success().isValid()).isTrue();
    }
}
