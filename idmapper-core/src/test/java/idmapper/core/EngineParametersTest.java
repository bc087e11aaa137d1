package idmapper.core;

import idmapper.data_structure.Cast;
import idmapper.data_structure.Role;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import static org.junit.Assert.*;

public class EngineParametersTest {
    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();
    File config;

    @Before
    public void setUp() throws IOException {
        config = new File(testFolder.getRoot(), "idmapper.cfg");
        System.setProperty(PropertyUtils.CONFIG_FILE_PROPERTY, config.getAbsolutePath());
        PropertyUtils.reload();
    }

    @After
    public void tearDown() {
        System.clearProperty(PropertyUtils.CONFIG_FILE_PROPERTY);
        PropertyUtils.reload();
    }

    @Test
    public void testDefaults() {
        EngineParameters p = EngineParameters.fromProperties();
        assertEquals(15, p.getLookahead());
        assertEquals(2.0, p.getStitchTimeGapSeconds(), 0);
        assertEquals(150, p.getStitchMaxDistance(), 0);
        assertEquals(100, p.getNoiseMaxDistance(), 0);
        assertEquals(30, p.getFps(), 0);
        assertEquals(50, p.getMaxHistory());
        assertEquals(5, p.getRamBuffer());
        assertEquals(Cast.DEFAULT_ROLES.size(), EngineParameters.castFromProperties().size());
    }

    @Test
    public void testStoreAndReload() {
        new EngineParameters().setLookahead(4).setFps(25).setNoiseMaxDistance(60).setRamBuffer(2).store();
        EngineParameters.storeCast(new Cast("Target", "Driver"));
        assertTrue(config.isFile());
        PropertyUtils.reload();
        EngineParameters p = EngineParameters.fromProperties();
        assertEquals(4, p.getLookahead());
        assertEquals(25, p.getFps(), 0);
        assertEquals(60, p.getNoiseMaxDistance(), 0);
        assertEquals(2, p.getRamBuffer());
        assertEquals(150, p.getStitchMaxDistance(), 0);
        assertEquals(Arrays.asList(Role.of("Target"), Role.of("Driver")), EngineParameters.castFromProperties().getRoles());
    }

    @Test
    public void testInvalidValueFallsBackToDefault() {
        PropertyUtils.set(EngineParameters.LOOKAHEAD, "many");
        assertEquals(EngineParameters.DEFAULT_LOOKAHEAD, EngineParameters.fromProperties().getLookahead());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidRamBuffer() {
        new EngineParameters().setRamBuffer(0);
    }
}
