package com.sharpgen.core.generator;

/**
 * Base exception for failures while generating source code.
 *
 * <p>Generation errors indicate a defect in how the model was built, never a recoverable
 * condition: no partial output is produced.
 */
public class CodeGenerationException extends RuntimeException {

    public CodeGenerationException(String message) {
        super(message);
    }

    public CodeGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
