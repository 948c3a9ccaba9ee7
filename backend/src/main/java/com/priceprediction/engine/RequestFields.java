package com.priceprediction.engine;

import com.priceprediction.dto.PropertyRequest;

import java.math.BigDecimal;

/** Field access by {@link PropertyField} and message formatting shared by the engine stages. */
final class RequestFields {

    private RequestFields() {
    }

    static boolean isMissing(PropertyRequest request, PropertyField field) {
        Object value = valueOf(request, field);
        return value == null || (value instanceof String && ((String) value).isBlank());
    }

    /** A value that carries information: false, 0 and blank count as not supplied. */
    static boolean isSupplied(PropertyRequest request, PropertyField field) {
        Object value = valueOf(request, field);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Integer) {
            return (Integer) value != 0;
        }
        if (value instanceof String) {
            return !((String) value).isBlank();
        }
        return true;
    }

    static Object valueOf(PropertyRequest request, PropertyField field) {
        switch (field) {
            case USAGE:
                return request.getUsage();
            case TYPE:
                return request.getType();
            case SUBTYPE:
                return request.getSubtype();
            case AREA_SIZE:
                return request.getAreaSize();
            case BEDROOMS:
                return request.getBedrooms();
            case HAS_PARKING:
                return request.getHasParking();
            case HAS_PROJECT:
                return request.getHasProject();
            case AREA_NAME:
                return request.getAreaName();
            case REGISTRATION_TYPE:
                return request.getRegistrationType();
            default:
                throw new IllegalArgumentException("Unhandled field " + field);
        }
    }

    static String describe(PropertyRequest request) {
        if (request.getUsage() == null || request.getType() == null) {
            return "this property";
        }
        return request.getUsage().getLabel() + " " + request.getType().getLabel();
    }

    /** 20.0 -> "20", 106.5 -> "106.5". */
    static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
