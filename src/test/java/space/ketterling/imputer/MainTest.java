package space.ketterling.imputer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path data;

    @AfterEach
    void clearDataDir() {
        System.clearProperty("data.dir");
    }

    @Test
    void missingInputsExitWithOne() {
        assertEquals(1, Main.run(new String[] { data.toString() }));
        assertEquals(data.toString(), System.getProperty("data.dir"));
    }
}
