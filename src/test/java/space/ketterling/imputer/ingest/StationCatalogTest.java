package space.ketterling.imputer.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import space.ketterling.imputer.MissingStationMetadataException;
import space.ketterling.imputer.model.StationMetadata;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

class StationCatalogTest {

    @TempDir
    Path tmp;

    private final ObjectMapper om = new ObjectMapper();
    private final StationCatalog catalog = new StationCatalog(om);

    private static final String CATALOG = "{\"data\":["
            + "{\"stationAttribute\":\"cwb\",\"item\":["
            + "{\"stationID\":\"466920\",\"longitude\":121.5148,\"latitude\":25.0377,\"altitude\":6.26,\"stationEndDate\":\"\"},"
            + "{\"stationID\":\"466910\",\"longitude\":121.5297,\"latitude\":25.1826,\"altitude\":null}"
            + "]},"
            + "{\"stationAttribute\":\"auto\",\"item\":["
            + "{\"stationID\":\"C0A520\",\"longitude\":\"121.4\",\"latitude\":\"24.9\",\"altitude\":\"120\",\"stationEndDate\":\"\"},"
            + "{\"stationID\":\"C0OLD1\",\"longitude\":121.0,\"latitude\":24.0,\"altitude\":10,\"stationEndDate\":\"2019-01-01\"}"
            + "]}]}";

    @Test
    void readsValidStationListTrimmedWithoutBlanks() throws IOException {
        Path f = tmp.resolve("stations_valid.txt");
        Files.writeString(f, "466920\n  C0A520  \n\n   \n466910\n466920\n", StandardCharsets.UTF_8);
        SortedSet<String> ids = StationCatalog.readValidStations(f);
        assertEquals(List.of("466910", "466920", "C0A520"), List.copyOf(ids));
    }

    @Test
    void resolvesActiveValidStations() throws IOException {
        SortedMap<String, StationMetadata> m = catalog.resolve(om.readTree(CATALOG),
                Set.of("466920", "466910", "C0A520"));
        assertEquals(3, m.size());
        StationMetadata tp = m.get("466920");
        assertEquals("cwb", tp.category());
        assertEquals(121.5148, tp.longitude());
        assertEquals(25.0377, tp.latitude());
        assertEquals(6.26, tp.altitude());
        assertNull(m.get("466910").altitude());
        assertEquals(120.0, m.get("C0A520").altitude());
        assertEquals("auto", m.get("C0A520").category());
    }

    @Test
    void retiredStationIsNotPlaced() throws IOException {
        MissingStationMetadataException e = assertThrows(MissingStationMetadataException.class,
                () -> catalog.resolve(om.readTree(CATALOG), Set.of("466920", "C0OLD1")));
        assertEquals(List.of("C0OLD1"), e.stationIds());
    }

    @Test
    void uncoveredStationsAreFatal() throws IOException {
        MissingStationMetadataException e = assertThrows(MissingStationMetadataException.class,
                () -> catalog.resolve(om.readTree(CATALOG), Set.of("466920", "ZZZ", "AAA")));
        assertEquals(List.of("AAA", "ZZZ"), e.stationIds());
    }

    @Test
    void stationWithoutCoordinatesIsFatal() throws IOException {
        String doc = "{\"data\":[{\"stationAttribute\":\"cwb\",\"item\":[{\"stationID\":\"X\",\"latitude\":25.0}]}]}";
        assertThrows(MissingStationMetadataException.class, () -> catalog.resolve(om.readTree(doc), Set.of("X")));
    }

    @Test
    void loadsFromFile() throws IOException {
        Path f = tmp.resolve("station_list.json");
        Files.writeString(f, CATALOG, StandardCharsets.UTF_8);
        assertEquals(Set.of("466920"), catalog.load(f, Set.of("466920")).keySet());
    }
}
