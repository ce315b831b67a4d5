package space.ketterling.imputer.output;

import space.ketterling.imputer.model.FlatObservation;
import space.ketterling.imputer.model.StationMetadata;

/**
 * A final output row: the (possibly imputed) observation plus its station's
 * location. {@code station} is null if the station has no catalog entry.
 */
public record ImputedRow(FlatObservation observation, StationMetadata station) {
}
