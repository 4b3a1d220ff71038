package tools.heatmap.sample;

import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SampleDataRepositoryTest {

    private final SampleDataRepository repository = new SampleDataRepository();

    @Test
    void parsesEntriesAndSkipsNulls() {
        String json = "[{\"label\":\"Allen\",\"details\":[{\"day\":1,\"count\":7000},{\"day\":3,\"count\":3000}]},"
                + "null,{\"label\":\"Dana\"}]";

        List<ActivityEntry> entries = repository.parse(new StringReader(json));

        assertEquals(2, entries.size());
        assertEquals("Allen", entries.get(0).getLabel());
        assertEquals(3, entries.get(0).getDetails().get(1).getDay());
        assertEquals(3000, entries.get(0).getDetails().get(1).getCount());
        assertTrue(entries.get(1).getDetails().isEmpty());
    }

    @Test
    void malformedJsonThrowsFromParse() {
        assertThrows(com.google.gson.JsonParseException.class,
                () -> repository.parse(new StringReader("[{\"label\": ")));
    }

    @Test
    void bundledSampleIsReadable() {
        List<ActivityEntry> entries = repository.loadFromClasspath("/sample-activities.json");

        assertEquals("Allen", entries.get(0).getLabel());
        assertEquals(7000, entries.get(0).getDetails().get(0).getCount());
    }

    @Test
    void missingResourceGivesEmptyList() {
        assertTrue(repository.loadFromClasspath("/no-such-file.json").isEmpty());
    }
}
