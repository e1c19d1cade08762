package win.ixuni.nimbus.core.util;

import java.util.regex.Pattern;

/**
 * Bucket 名称校验
 * <p>
 * 3-63 characters of lowercase letters, digits, dots and hyphens, starting and ending with a
 * letter or digit; no adjacent dots and not formatted as an IPv4 address.
 */
public final class BucketNameValidator {

    private static final Pattern CHARACTERS = Pattern.compile("^[a-z0-9.-]+$");
    private static final Pattern IP_ADDRESS = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private BucketNameValidator() {
    }

    public static boolean isValid(String bucketName) {
        return violation(bucketName) == null;
    }

    /**
     * @return the first rule the name breaks, or {@code null} for a valid name
     */
    public static String violation(String bucketName) {
        if (bucketName == null || bucketName.length() < 3 || bucketName.length() > 63) {
            return "name must be between 3 and 63 characters long";
        }
        if (!CHARACTERS.matcher(bucketName).matches()) {
            return "name may only contain lowercase letters, digits, dots and hyphens";
        }
        if (!isAlphanumeric(bucketName.charAt(0)) || !isAlphanumeric(bucketName.charAt(bucketName.length() - 1))) {
            return "name must begin and end with a letter or digit";
        }
        if (bucketName.contains("..")) {
            return "name must not contain adjacent dots";
        }
        if (IP_ADDRESS.matcher(bucketName).matches()) {
            return "name must not be formatted as an IP address";
        }
        return null;
    }

    private static boolean isAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
    }
}
