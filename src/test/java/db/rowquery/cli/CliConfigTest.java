package db.rowquery.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Paths;

import org.junit.jupiter.api.Test;

public class CliConfigTest {

    @Test
    void defaults() {
        CliConfig c = CliConfig.fromArgs(new String[0]);
        assertEquals(Paths.get("data"), c.dataDir);
        assertEquals("table", c.format);
        assertEquals(0, c.limit);
    }

    @Test
    void parsesFlags() {
        CliConfig c = CliConfig.fromArgs(new String[] {"--data=/tmp/tables", "--format=csv", "--limit=25", "--verbose"});
        assertEquals(Paths.get("/tmp/tables"), c.dataDir);
        assertEquals("csv", c.format);
        assertEquals(25, c.limit);
    }

    @Test
    void malformedValuesKeepDefaults() {
        CliConfig c = CliConfig.fromArgs(new String[] {"--limit=lots", "--format=", null});
        assertEquals(0, c.limit);
        assertEquals("table", c.format);
    }
}
