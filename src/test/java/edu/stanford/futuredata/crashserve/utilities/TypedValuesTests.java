package edu.stanford.futuredata.crashserve.utilities;

import edu.stanford.futuredata.crashserve.TypedValue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TypedValuesTests {

    @Test
    public void testVariants() {
        assertEquals(TypedValue.ValueCase.STRING_VALUE, TypedValues.of("x").getValueCase());
        assertEquals(TypedValue.ValueCase.INT_VALUE, TypedValues.of(7L).getValueCase());
        assertEquals(TypedValue.ValueCase.DOUBLE_VALUE, TypedValues.of(1.5).getValueCase());
        assertEquals(TypedValue.ValueCase.BOOL_VALUE, TypedValues.of(true).getValueCase());
        assertEquals(7L, TypedValues.unwrap(TypedValues.of(7L)));
        assertEquals(1.5, TypedValues.unwrap(TypedValues.of(1.5)));
        assertEquals(Boolean.FALSE, TypedValues.unwrap(TypedValues.of(false)));
        assertEquals("", TypedValues.unwrap(TypedValues.of("")));
    }

    @Test
    public void testOnlyLastVariantIsSet() {
        TypedValue v = TypedValue.newBuilder().setStringValue("x").setIntValue(3).build();
        assertEquals(TypedValue.ValueCase.INT_VALUE, v.getValueCase());
        assertEquals("", v.getStringValue());
    }

    @Test
    public void testUnset() {
        TypedValue unset = TypedValue.getDefaultInstance();
        assertThrows(IllegalArgumentException.class, () -> TypedValues.unwrap(unset));
        assertEquals("", TypedValues.render(unset));
        assertEquals("42", TypedValues.render(TypedValues.of(42L)));
    }
}
