package com.worksrec.api;

import com.worksrec.parser.ParserDtos.ParseError;
import com.worksrec.service.SnapshotImportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SnapshotImportException.class)
    public ResponseEntity<ErrorResponse> invalidSnapshot(SnapshotImportException e) {
        log.warn("rejected snapshot errors={} first={}", e.errors().size(),
                e.errors().isEmpty() ? "none" : e.errors().get(0).code());
        return ResponseEntity.badRequest().body(new ErrorResponse(e.errors()));
    }

    public record ErrorResponse(List<ParseError> errors) {}
}
