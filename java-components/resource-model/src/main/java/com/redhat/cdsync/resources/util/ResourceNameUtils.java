package com.redhat.cdsync.resources.util;

import java.util.regex.Pattern;

public class ResourceNameUtils {

    private static final Pattern DNS_SUBDOMAIN = Pattern
            .compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]*[a-z0-9])?)*");
    private static final Pattern DNS_LABEL = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?");

    public static boolean isValidName(String name) {
        return name != null && name.length() <= 253 && DNS_SUBDOMAIN.matcher(name).matches();
    }

    public static boolean isValidNamespace(String namespace) {
        return namespace != null && namespace.length() <= 63 && DNS_LABEL.matcher(namespace).matches();
    }
}
