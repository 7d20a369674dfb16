package com.example.org_membershipservice.exception;

import com.example.org_membershipservice.entity.OrgUnitType;
import org.springframework.http.HttpStatus;

/**
 * Exception for invalid business logic requests.
 * Returns HTTP 400 BAD_REQUEST.
 */
public class BadRequestException extends BaseException {

    public BadRequestException(String code, String message) {
        super(code, message, HttpStatus.BAD_REQUEST);
    }

    public static BadRequestException invalidHierarchy(OrgUnitType parentType, OrgUnitType childType) {
        return new BadRequestException("INVALID_HIERARCHY",
            String.format("A %s cannot be created under a %s", childType, parentType));
    }

    public static BadRequestException invalidField(String field, String reason) {
        return new BadRequestException("INVALID_FIELD",
            String.format("Invalid %s: %s", field, reason));
    }
}
