package com.linkshelf.refresh.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.CONFLICT)
public class LinkRefreshInProgressException extends RuntimeException {
    public LinkRefreshInProgressException(UUID linkId) {
        super("Link " + linkId + " is already being refreshed");
    }
}
