package work.lcod.flow.connectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HttpMethodsTest {
    @Test
    void mapsReadVerbsToGet() {
        assertEquals("GET", HttpMethods.infer("fetch"));
        assertEquals("GET", HttpMethods.infer("Search"));
    }

    @Test
    void mapsWriteVerbs() {
        assertEquals("POST", HttpMethods.infer("charge"));
        assertEquals("PUT", HttpMethods.infer("update"));
        assertEquals("DELETE", HttpMethods.infer("CANCEL"));
    }

    @Test
    void unknownVerbsPost() {
        assertEquals("POST", HttpMethods.infer("reserve"));
    }

    @Test
    void onlyGetAndDeleteUseQueryString() {
        assertTrue(HttpMethods.usesQueryString("GET"));
        assertTrue(HttpMethods.usesQueryString("DELETE"));
        assertFalse(HttpMethods.usesQueryString("PUT"));
    }
}
