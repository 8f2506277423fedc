package com.termaccess.backend.modules.taxonomy.application;

import com.termaccess.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class TermNotFoundException extends ProblemException {

    public TermNotFoundException(String name) {
        super(HttpStatus.NOT_FOUND, "taxonomy.term_not_found", "No term named '" + name + "'");
    }
}
