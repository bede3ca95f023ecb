package com.cmflineage.query;

public record ExecutionTypeId(String contextType, String toolName, String uuid) {
    public static ExecutionTypeId parse(String value) {
        int slash = value == null ? -1 : value.indexOf('/');
        int underscore = value == null ? -1 : value.lastIndexOf('_');
        if (slash <= 0 || underscore <= slash + 1 || underscore == value.length() - 1) {
            throw new IllegalArgumentException("Malformed execution type id: " + value);
        }
        return new ExecutionTypeId(value.substring(0, slash), value.substring(slash + 1, underscore), value.substring(underscore + 1));
    }

    @Override
    public String toString() {
        return contextType + "/" + toolName + "_" + uuid;
    }
}
