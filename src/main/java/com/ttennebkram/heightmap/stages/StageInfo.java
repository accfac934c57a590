package com.ttennebkram.heightmap.stages;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for Stage classes to declare their metadata.
 * {@link StageBase} reads it at runtime so stages don't repeat their names in code.
 *
 * Example usage:
 * <pre>
 * {@literal @}StageInfo(
 *     nodeType = "GaussianBlur",
 *     displayName = "Gaussian Blur 3x3",
 *     category = "Blur",
 *     description = "Fixed [1 2 1; 2 4 2; 1 2 1] / 16 kernel, clamped borders"
 * )
 * public class GaussianBlurStage extends StageBase&lt;IntensityGrid&gt; { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface StageInfo {

    /**
     * The stage type name (e.g., "BilateralFilter").
     * Also the key the stage's properties are stored under in settings JSON.
     */
    String nodeType();

    /**
     * Display name for logs. If empty, defaults to nodeType.
     */
    String displayName() default "";

    /**
     * Category for grouping (e.g., "Blur", "Sharpen", "Transform").
     */
    String category();

    /**
     * One-line description of the operation.
     */
    String description() default "";
}
