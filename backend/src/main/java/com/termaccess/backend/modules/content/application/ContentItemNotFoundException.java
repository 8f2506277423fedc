package com.termaccess.backend.modules.content.application;

import com.termaccess.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class ContentItemNotFoundException extends ProblemException {

    public ContentItemNotFoundException(long contentItemId) {
        super(HttpStatus.NOT_FOUND, "content.not_found", "Content item " + contentItemId + " does not exist");
    }
}
