package com.linkshelf.refresh.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.CONFLICT)
public class LinkArchivedException extends RuntimeException {
    public LinkArchivedException(UUID linkId) {
        super("Link " + linkId + " is archived and is not refreshed");
    }
}
