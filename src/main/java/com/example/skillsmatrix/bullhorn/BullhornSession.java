package com.example.skillsmatrix.bullhorn;

/**
 * Token and base URL returned by the REST login, required by every entity call.
 */
public record BullhornSession(
        String bhRestToken,
        String restUrl
) {

    @Override
    public String toString() {
        return "BullhornSession[restUrl=" + restUrl + "]";
    }
}
