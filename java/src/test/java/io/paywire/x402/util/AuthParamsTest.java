package io.paywire.x402.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuthParamsTest {

    @Test
    void parsesQuotedAndBareValues() {
        Map<String, String> p = AuthParams.parse("amount=10000 recipient=0xabc description=\"Premium data feed\"");
        assertEquals("10000", p.get("amount"));
        assertEquals("0xabc", p.get("recipient"));
        assertEquals("Premium data feed", p.get("description"));
    }

    @Test
    void formatQuotesOnlyWhereNeeded() {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("amount", "10");
        p.put("description", "say \"hi\" there");
        p.put("skipped", null);
        assertEquals("x402 amount=10 description=\"say 'hi' there\"", AuthParams.format("x402", p));
    }

    @Test
    void nullParsesToEmpty() {
        assertTrue(AuthParams.parse(null).isEmpty());
    }
}
