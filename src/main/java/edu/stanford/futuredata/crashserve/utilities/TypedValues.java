package edu.stanford.futuredata.crashserve.utilities;

import edu.stanford.futuredata.crashserve.TypedValue;

public class TypedValues {

    private TypedValues() {}

    public static TypedValue of(String value) {
        return TypedValue.newBuilder().setStringValue(value).build();
    }

    public static TypedValue of(long value) {
        return TypedValue.newBuilder().setIntValue(value).build();
    }

    public static TypedValue of(double value) {
        return TypedValue.newBuilder().setDoubleValue(value).build();
    }

    public static TypedValue of(boolean value) {
        return TypedValue.newBuilder().setBoolValue(value).build();
    }

    /** The active variant as a boxed Java value.  An unset value is rejected rather than defaulted. */
    public static Object unwrap(TypedValue value) {
        switch (value.getValueCase()) {
            case STRING_VALUE:
                return value.getStringValue();
            case INT_VALUE:
                return value.getIntValue();
            case DOUBLE_VALUE:
                return value.getDoubleValue();
            case BOOL_VALUE:
                return value.getBoolValue();
            default:
                throw new IllegalArgumentException("TypedValue has no variant set");
        }
    }

    public static String render(TypedValue value) {
        if (value.getValueCase() == TypedValue.ValueCase.VALUE_NOT_SET) {
            return "";
        }
        return String.valueOf(unwrap(value));
    }
}
