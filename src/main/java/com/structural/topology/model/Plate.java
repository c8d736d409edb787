package com.structural.topology.model;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Four-joint surface element of a plate mesh.
 *
 * Corner order follows the mesh index grid: (i,j), (i+1,j), (i+1,j+1), (i,j+1).
 */
@Value
public class Plate {
    int id;
    @NonNull
    List<Integer> joints;
    @NonNull
    PlateComponent component;
    double thickness;
}
