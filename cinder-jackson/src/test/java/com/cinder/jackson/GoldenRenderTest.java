package com.cinder.jackson;

import com.cinder.ast.ModuleStatement;
import com.cinder.ast.Statement;
import com.cinder.json.AstJsonProvider;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class GoldenRenderTest {

    private static String readGolden(String name) throws IOException {
        try (InputStream in = GoldenRenderTest.class.getResourceAsStream("/golden/" + name)) {
            assertNotNull(in, "missing golden fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void testRendersModuleFromJsonToExpectedC() throws Exception {
        String json = readGolden("counter.json");
        String expected = readGolden("counter.c");

        Statement statement = AstJsonProvider.getProvider().getDeserializer().deserializeStatement(json);

        assertInstanceOf(ModuleStatement.class, statement);
        assertEquals(expected, statement.render());
    }

    @Test
    void testGoldenModuleSurvivesRoundTrip() throws Exception {
        AstJsonProvider provider = AstJsonProvider.getProvider("jackson");
        String json = readGolden("counter.json");

        Statement first = provider.getDeserializer().deserializeStatement(json);
        String written = provider.getSerializer().serialize(first);
        Statement second = provider.getDeserializer().deserializeStatement(written);

        assertEquals(first, second);
        assertEquals(first.render(), second.render());
    }
}
