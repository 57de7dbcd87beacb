package com.accountdb.bancheck.check.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class BanCheckValidationException extends RuntimeException {
    public BanCheckValidationException(String message) {
        super(message);
    }
}
