package org.apache.credctl.utils;

import org.apache.commons.lang3.StringUtils;

import org.apache.credctl.auth.exceptions.InvalidArgumentException;

/**
 * Validation for user supplied arguments.
 */
public class ValidationUtil {

    public static void validateUserName(String userName) {
        if (StringUtils.isBlank(userName)) {
            throw new InvalidArgumentException("User name must not be empty");
        }
        if (userName.length() > ApiMetadata.MAX_USER_NAME_LENGTH) {
            throw new InvalidArgumentException(
                    "User name exceeds " + ApiMetadata.MAX_USER_NAME_LENGTH + " characters");
        }
        for (int i = 0; i < userName.length(); i++) {
            if (Character.isISOControl(userName.charAt(i))) {
                throw new InvalidArgumentException(
                        "User name contains a control character at index " + i);
            }
        }
    }
}
