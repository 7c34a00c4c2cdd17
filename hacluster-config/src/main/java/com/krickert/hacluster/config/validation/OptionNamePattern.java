package com.krickert.hacluster.config.validation;

/**
 * A family of user defined option names sharing a prefix, such as exec_NAME.
 *
 * @param prefix      The literal prefix every matching name starts with.
 * @param displayName How the family is presented to the user.
 */
public record OptionNamePattern(String prefix, String displayName) {

    public static OptionNamePattern prefixed(String prefix, String displayName) {
        return new OptionNamePattern(prefix, displayName);
    }

    public boolean matches(String name) {
        return name != null && name.startsWith(prefix);
    }
}
