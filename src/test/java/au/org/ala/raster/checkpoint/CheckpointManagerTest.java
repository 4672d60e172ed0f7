package au.org.ala.raster.checkpoint;

import au.org.ala.raster.TestBase;
import org.apache.commons.io.FileUtils;
import org.json.JSONObject;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class CheckpointManagerTest extends TestBase {

    private File dir;
    private CheckpointManager manager;

    @Before
    public void setUp() throws Exception {
        dir = Files.createTempDirectory("checkpoint").toFile();
        manager = new CheckpointManager(new File(dir, "mandelbrot_deepzoom_progress.json"));
    }

    @After
    public void tearDown() throws Exception {
        FileUtils.deleteDirectory(dir);
    }

    @Test
    public void savedCheckpointLoadsBack() throws Exception {
        Checkpoint checkpoint = new Checkpoint(2, 17, 60, 750, 100.0);
        manager.save(checkpoint);
        assertEquals(checkpoint, manager.load().get());
        assertFalse("temp file left behind", new File(dir, manager.getFile().getName() + ".tmp").exists());

        JSONObject json = new JSONObject(FileUtils.readFileToString(manager.getFile(), StandardCharsets.UTF_8));
        assertEquals(2, json.getInt("im_scale"));
        assertEquals(17, json.getInt("current_strip"));
        assertEquals(60, json.getInt("total_strips"));
        assertEquals(750, json.getInt("max_iter"));
        assertEquals(100.0, json.getDouble("color_reference"), 0.0);
        assertFalse(json.has("pyramid_level"));
    }

    @Test
    public void laterSaveReplacesEarlier() throws Exception {
        manager.save(new Checkpoint(1, 1, 30, 750, 100.0));
        manager.save(new Checkpoint(1, 30, 30, 750, 100.0).withPyramidLevel(6));
        Checkpoint loaded = manager.load().get();
        assertTrue(loaded.isComplete());
        assertEquals(6, loaded.getPyramidLevel());
        assertEquals(100.0, loaded.getCompletionPercent(), 1e-9);
    }

    @Test
    public void missingOrClearedCheckpointIsEmpty() throws Exception {
        assertFalse(manager.load().isPresent());
        manager.save(new Checkpoint(1, 3, 30, 750, 100.0));
        manager.clear();
        assertFalse(manager.getFile().exists());
        assertFalse(manager.load().isPresent());
        manager.clear();
    }

    @Test
    public void unreadableCheckpointIsIgnored() throws Exception {
        FileUtils.writeStringToFile(manager.getFile(), "{\"im_scale\": 1, \"current_str", StandardCharsets.UTF_8);
        assertFalse(manager.load().isPresent());

        FileUtils.writeStringToFile(manager.getFile(), "{\"im_scale\": 1}", StandardCharsets.UTF_8);
        assertFalse(manager.load().isPresent());

        FileUtils.writeStringToFile(manager.getFile(),
                "{\"im_scale\": 1, \"current_strip\": 31, \"total_strips\": 30, \"max_iter\": 750, \"color_reference\": 100}",
                StandardCharsets.UTF_8);
        assertFalse(manager.load().isPresent());
    }

    @Test
    public void fileWrittenByOtherToolsIsAccepted() throws Exception {
        FileUtils.writeStringToFile(manager.getFile(),
                "{\"im_scale\": 3, \"current_strip\": 45, \"total_strips\": 90, \"max_iter\": 750, \"color_reference\": 100}",
                StandardCharsets.UTF_8);
        Checkpoint loaded = manager.load().get();
        assertEquals(3, loaded.getScale());
        assertEquals(50.0, loaded.getCompletionPercent(), 1e-9);
        assertEquals(Checkpoint.NO_PYRAMID_LEVEL, loaded.getPyramidLevel());
        assertTrue(loaded.matches(750, 100.0));
        assertFalse(loaded.matches(500, 100.0));
        assertFalse(loaded.matches(750, 50.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void pyramidLevelNeedsAllStrips() {
        new Checkpoint(1, 10, 30, 750, 100.0, 4);
    }
}
