package com.priceprediction.controller;

import com.priceprediction.config.RequestGuardFilter;
import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;

final class RequestIds {

    private RequestIds() {
    }

    static String resolve(HttpServletRequest request) {
        Object assigned = request.getAttribute(RequestGuardFilter.REQUEST_ID_ATTRIBUTE);
        if (assigned instanceof String && !((String) assigned).isBlank()) {
            return (String) assigned;
        }
        String id = request.getHeader(RequestGuardFilter.REQUEST_ID_HEADER);
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
