package com.phillippitts.mathspeech.service.postprocess;

/**
 * One normalization step over speech text. Implementations must be stateless and idempotent:
 * applying a pass to its own output returns that output unchanged.
 */
public interface TextPass {

    String name();

    String apply(String text);
}
