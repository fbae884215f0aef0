package com.eyelevel.documenttranslator.service.submission;

import com.eyelevel.documenttranslator.config.DocumentTranslationConfig;
import com.eyelevel.documenttranslator.exception.FileTooLargeException;
import com.eyelevel.documenttranslator.exception.InvalidDocumentException;
import com.eyelevel.documenttranslator.exception.UnsupportedFileTypeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentValidationServiceTest {

    private DocumentValidationService validationService;

    @BeforeEach
    void setUp() {
        DocumentTranslationConfig config = new DocumentTranslationConfig();
        config.setMaxFileSize(1024 * 1024);
        validationService = new DocumentValidationService(config);
    }

    @Test
    void testValidate_AcceptsSupportedTypeAndReturnsLowerCaseExtension() {
        assertThat(validationService.validate("Report.PDF", 2048)).isEqualTo("pdf");
        assertThat(validationService.validate("C:\\Users\\me\\notes.txt", 10)).isEqualTo("txt");
    }

    @Test
    void testValidate_RejectsUnsupportedType() {
        assertThatThrownBy(() -> validationService.validate("sheet.xlsx", 2048))
                .isInstanceOf(UnsupportedFileTypeException.class)
                .hasMessageStartingWith("Unsupported file type: .xlsx");
    }

    @Test
    void testValidate_RejectsEmptyHiddenAndUnnamedFiles() {
        assertThatThrownBy(() -> validationService.validate("empty.txt", 0))
                .isInstanceOf(InvalidDocumentException.class);
        assertThatThrownBy(() -> validationService.validate(".secret.txt", 100))
                .isInstanceOf(InvalidDocumentException.class);
        assertThatThrownBy(() -> validationService.validate("", 100))
                .isInstanceOf(InvalidDocumentException.class);
        assertThatThrownBy(() -> validationService.validate(null, 100))
                .isInstanceOf(InvalidDocumentException.class);
    }

    @Test
    void testValidate_RejectsOversizedFile() {
        assertThatThrownBy(() -> validationService.validate("big.docx", 2L * 1024 * 1024))
                .isInstanceOf(FileTooLargeException.class)
                .hasMessageContaining("2 MB");
    }
}
