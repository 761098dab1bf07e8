package com.stepflow.pipeline;

import com.stepflow.stepconfig.Source;
import com.stepflow.stepinterface.StepInterfaceException;
import com.stepflow.stepinterface.StepflowException;

import java.lang.reflect.Modifier;

/**
 * Checks that a hook source denotes a concrete class implementing the expected hook interface
 * with a public no-argument constructor.
 */
final class HookValidator {

    private HookValidator() {
    }

    static Source validate(Source source, Class<?> expected) {
        Class<?> hookClass;
        try {
            hookClass = source.load();
        } catch (StepflowException e) {
            throw new StepInterfaceException("Hook source '" + source + "' cannot be loaded", e);
        }
        if (!expected.isAssignableFrom(hookClass)) {
            throw new StepInterfaceException("Hook " + hookClass.getName() + " must implement " + expected.getSimpleName());
        }
        if (hookClass.isInterface() || Modifier.isAbstract(hookClass.getModifiers())) {
            throw new StepInterfaceException("Hook " + hookClass.getName() + " must be a concrete class");
        }
        try {
            hookClass.getConstructor();
        } catch (NoSuchMethodException e) {
            throw new StepInterfaceException("Hook " + hookClass.getName() + " needs a public no-argument constructor", e);
        }
        return source;
    }
}
