package io.pqcscan.audit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputValidatorTest {

    private final InputValidator validator = new InputValidator(8);

    @ParameterizedTest
    @ValueSource(strings = {"a.py", "src/main/App.java", "python", "dir\\file.go", "..hidden/x.py", "a..b.rs"})
    void validatePath_acceptsOrdinaryPaths(String path) {
        assertThatCode(() -> validator.validatePath(path)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"..", "../a.py", "a/../b.py", "a\\..\\b.py", "", "   "})
    void validatePath_rejectsTraversalAndBlank(String path) {
        assertThatThrownBy(() -> validator.validatePath(path)).isInstanceOf(AuditException.class);
    }

    @Test
    void validatePath_rejectsNulAndNull() {
        assertThatThrownBy(() -> validator.validatePath("a\0.py")).hasMessageContaining("NUL");
        assertThatThrownBy(() -> validator.validatePath(null)).isInstanceOf(AuditException.class);
    }

    @Test
    void validate_countsUtf8Bytes() {
        assertThatCode(() -> validator.validate("éééé", "a.py")).doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validate("ééééa", "a.py"))
                .isInstanceOf(AuditException.class)
                .hasMessageContaining("9 bytes");
    }
}
