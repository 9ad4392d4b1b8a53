package com.lyshra.open.objects.core.exception;

import com.lyshra.open.objects.core.id.ObjectId;

/**
 * Raised when a location update violates an invariant that a trusted, internal
 * sender must uphold (e.g. a spill report without a spill URL).
 *
 * This is a fatal consistency error and is never recovered from inside the directory.
 */
public class LocationConsistencyException extends LyshraOpenObjectsRuntimeException {

    private final ObjectId objectId;

    public LocationConsistencyException(String message) {
        this(message, null);
    }

    public LocationConsistencyException(String message, ObjectId objectId) {
        super(objectId == null ? message : message + ". ObjectId: [" + objectId + "]");
        this.objectId = objectId;
    }

    public ObjectId getObjectId() {
        return objectId;
    }
}
