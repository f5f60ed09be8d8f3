package com.visitrack.intake.runtime.privacy;

/**
 * The fields of a visit that are subject to the privacy rules. Any of them may be null.
 *
 * @param path        request path
 * @param userAgent   user agent as it would be stored
 * @param address     address as it would be stored
 * @param addressHash salted hash of the client address
 */
public record VisitRecord(String path, String userAgent, String address, String addressHash) {
}
