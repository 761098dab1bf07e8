package com.stepflow.stepinterface;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InputTypeCheckerTest {

    public static class Point {
        public int x;
        public int y;
    }

    enum Mode { FAST, SLOW }

    @Test
    void accepts_rangeChecksIntegralScalars() {
        DeclaredType shortType = DeclaredType.ofClass(Short.class);

        assertTrue(InputTypeChecker.accepts(shortType, 12));
        assertFalse(InputTypeChecker.accepts(shortType, 70_000));
        assertFalse(InputTypeChecker.accepts(shortType, 1.5));
        assertTrue(InputTypeChecker.accepts(DeclaredType.ofClass(Double.class), 3));
        assertFalse(InputTypeChecker.accepts(DeclaredType.ofClass(String.class), 3));
    }

    @Test
    void accepts_unionMembersAndNull() {
        DeclaredType optionalString = DeclaredType.unionOf(String.class, Void.class);

        assertTrue(InputTypeChecker.accepts(optionalString, null));
        assertTrue(InputTypeChecker.accepts(optionalString, "x"));
        assertFalse(InputTypeChecker.accepts(optionalString, 1));
        assertFalse(InputTypeChecker.accepts(DeclaredType.ofClass(String.class), null));
        assertTrue(InputTypeChecker.accepts(DeclaredType.ANY, null));
    }

    @Test
    void accepts_mapsForBeansAndNamesForEnums() {
        assertTrue(InputTypeChecker.accepts(DeclaredType.ofClass(Point.class), Map.of("x", 1, "y", 2)));
        assertTrue(InputTypeChecker.accepts(DeclaredType.ofClass(Mode.class), "FAST"));
        assertFalse(InputTypeChecker.accepts(DeclaredType.ofClass(Mode.class), "MEDIUM"));
        assertFalse(InputTypeChecker.accepts(DeclaredType.ofClass(List.class), Map.of()));
    }

    @Test
    void coerce_convertsToParameterType() {
        assertEquals(3L, InputTypeChecker.coerce(long.class, 3));
        assertEquals(Mode.SLOW, InputTypeChecker.coerce(Mode.class, "SLOW"));
        Point point = (Point) InputTypeChecker.coerce(Point.class, Map.of("x", 4, "y", 5));
        assertEquals(4, point.x);
        assertEquals(5, point.y);
        assertThrows(StepInterfaceException.class, () -> InputTypeChecker.coerce(int.class, null));
    }

    @Test
    void validateInput_namesStepInputAndType() {
        StepInterfaceException e = assertThrows(StepInterfaceException.class,
                () -> InputTypeChecker.validateInput("trainer", "epochs", DeclaredType.ofClass(Integer.class), "ten"));

        assertTrue(e.getMessage().contains("'epochs'"));
        assertTrue(e.getMessage().contains("'trainer'"));
        assertTrue(e.getMessage().contains("INTEGER"));
        assertDoesNotThrow(() -> InputTypeChecker.validateInput("trainer", "epochs", DeclaredType.ofClass(Integer.class), 10));
    }

    @Test
    void isJsonSerializable_rejectsNonStringKeysAndEmptyBeans() {
        assertTrue(JsonValues.isJsonSerializable(Map.of("a", List.of(1, "b", true))));
        assertFalse(JsonValues.isJsonSerializable(Map.of(1, "a")));
        assertFalse(JsonValues.isJsonSerializable(new Object()));
        assertTrue(JsonValues.isJsonSerializable(new Point()));
    }
}
