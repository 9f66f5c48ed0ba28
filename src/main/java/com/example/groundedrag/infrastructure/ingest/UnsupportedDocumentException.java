package com.example.groundedrag.infrastructure.ingest;

import com.example.groundedrag.controller.exception.BusinessException;
import org.springframework.http.HttpStatus;

public class UnsupportedDocumentException extends BusinessException {

    public UnsupportedDocumentException(String fileName) {
        super(HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                "Unsupported file type: " + fileName + " (supported: " + String.join(", ", DocumentParser.SUPPORTED_EXTENSIONS) + ")");
    }
}
