package com.questrail.aviationwx.model;

import java.util.Objects;

/**
 * Low-level wind shear forecast ({@code WShhh/dddffKT}).
 *
 * @param heightFeet height of the shear layer in feet
 * @param wind       wind at that height
 */
public record WindShear(int heightFeet, Wind wind)
{
    public WindShear {
        Objects.requireNonNull(wind, "wind");
        if (heightFeet < 0) {
            throw new IllegalArgumentException("wind shear height must be non-negative");
        }
    }
}
