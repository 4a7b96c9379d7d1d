package com.questrail.irrigation.weather;

/**
 * Crop-specific factors applied to the reference evapotranspiration.
 *
 * @param cropCoefficient the FAO-56 crop coefficient (Kc); turf grass is
 *                        typically between 0.6 and 0.95
 */
public record CropParameters(double cropCoefficient) {
    /** Kc = 1, i.e. the reference crop itself. */
    public static final CropParameters REFERENCE = new CropParameters(1.0);

    public CropParameters {
        if (!(cropCoefficient > 0.0) || Double.isInfinite(cropCoefficient)) {
            throw new IllegalArgumentException("cropCoefficient must be a positive number");
        }
    }
}
