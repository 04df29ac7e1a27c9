package com.studyspots.util;

import com.studyspots.exception.InvalidInputException;
import org.bson.types.ObjectId;

public final class ObjectIds {

    private ObjectIds() {
    }

    public static boolean isValid(String id) {
        return id != null && ObjectId.isValid(id);
    }

    public static String requireValid(String id, String field) {
        if (!isValid(id)) {
            throw new InvalidInputException("Invalid " + field + ": " + id);
        }
        return id;
    }
}
