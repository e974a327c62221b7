package com.reliquary.data;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link JsonResourceLoader} utility class.
 */
public class JsonResourceLoaderTest {

    private Gson gson;

    @Before
    public void setUp() {
        gson = GsonFactory.create();
    }

    // ========================================================================
    // load() / loadAs()
    // ========================================================================

    @Test(expected = JsonResourceLoader.JsonLoadException.class)
    public void testLoad_NonexistentResource_ThrowsException() {
        JsonResourceLoader.load(gson, "/nonexistent/path/to/resource.json");
    }

    @Test
    public void testLoad_ExistingResource_ReturnsObject() {
        JsonObject root = JsonResourceLoader.load(gson, "/data/test-relics.json");
        assertTrue(root.has("relics"));
        assertTrue(root.has("locations"));
    }

    @Test
    public void testLoadAs_BindsType() {
        JsonObject config = JsonResourceLoader.loadAs(gson, "/reliquary.json", JsonObject.class);
        assertEquals("/data/relics.json", config.get("catalogPath").getAsString());
    }

    // ========================================================================
    // tryLoadOptional() Tests
    // ========================================================================

    @Test
    public void testTryLoadOptional_NonexistentResource_ReturnsNull() {
        JsonObject result = JsonResourceLoader.tryLoadOptional(gson, "/nonexistent/resource.json");
        assertNull("tryLoadOptional should return null for missing resources", result);
    }

    @Test
    public void testTryLoadOptional_ExistingResource_ReturnsObject() {
        assertNotNull(JsonResourceLoader.tryLoadOptional(gson, "/data/test-relics.json"));
    }

    // ========================================================================
    // Required field accessors
    // ========================================================================

    @Test
    public void testGetRequiredArray_Exists_ReturnsArray() {
        JsonObject root = new JsonObject();
        JsonArray array = new JsonArray();
        array.add("x");
        root.add("items", array);

        assertEquals(1, JsonResourceLoader.getRequiredArray(root, "items").size());
    }

    @Test(expected = JsonResourceLoader.JsonLoadException.class)
    public void testGetRequiredArray_WrongType_ThrowsException() {
        JsonObject root = new JsonObject();
        root.addProperty("items", "not an array");

        JsonResourceLoader.getRequiredArray(root, "items");
    }

    @Test
    public void testGetRequiredString_Exists_ReturnsValue() {
        JsonObject root = new JsonObject();
        root.addProperty("id", "Mormegil");

        assertEquals("Mormegil", JsonResourceLoader.getRequiredString(root, "id"));
    }

    @Test(expected = JsonResourceLoader.JsonLoadException.class)
    public void testGetRequiredString_Number_ThrowsException() {
        JsonObject root = new JsonObject();
        root.addProperty("id", 12);

        JsonResourceLoader.getRequiredString(root, "id");
    }
}
