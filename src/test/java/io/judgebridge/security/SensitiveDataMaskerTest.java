package io.judgebridge.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.judgebridge.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {

    @Test
    void credentialFieldsAreMaskedAtAnyDepth() throws Exception {
        JsonNode input = Jsons.readTree("""
                {"name":"handshake","id":"j1","key":"s3cret-key",
                 "extra":[{"auth_token":"t0k"},{"api-key":"abc","monkey":"banana"}],
                 "nested":{"Password":"hunter2","keyboard":"qwerty"}}
                """);
        JsonNode masked = SensitiveDataMasker.masked(input);

        Assertions.assertEquals("***", masked.path("key").asText());
        Assertions.assertEquals("***", masked.path("extra").get(0).path("auth_token").asText());
        Assertions.assertEquals("***", masked.path("extra").get(1).path("api-key").asText());
        Assertions.assertEquals("***", masked.path("nested").path("Password").asText());
        Assertions.assertEquals("banana", masked.path("extra").get(1).path("monkey").asText());
        Assertions.assertEquals("qwerty", masked.path("nested").path("keyboard").asText());
        Assertions.assertEquals("j1", masked.path("id").asText());
        // The caller's tree is not modified.
        Assertions.assertEquals("s3cret-key", input.path("key").asText());
    }

    @Test
    void longJudgeOutputIsNotMistakenForASecret() throws Exception {
        String feedback = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789abcdef";
        JsonNode input = Jsons.readTree("{\"name\":\"test-case-status\",\"cases\":[{\"feedback\":\"" + feedback
                + "\",\"output\":\"" + feedback + "\"}]}");
        JsonNode item = SensitiveDataMasker.masked(input).path("cases").get(0);
        Assertions.assertEquals(feedback, item.path("feedback").asText());
        Assertions.assertEquals(feedback, item.path("output").asText());
    }

    @Test
    void rawPacketsAreMaskedOrWithheld() {
        Assertions.assertEquals(
                "{\"name\":\"handshake\",\"key\":\"***\"}",
                SensitiveDataMasker.maskedPacket("{\"name\":\"handshake\",\"key\":\"k\"}")
        );
        Assertions.assertEquals(
                "<withheld: possible credential>",
                SensitiveDataMasker.maskedPacket("{\"name\":\"handshake\",\"key\":\"k\"")
        );
        Assertions.assertEquals("not json", SensitiveDataMasker.maskedPacket("not json"));
        Assertions.assertEquals("", SensitiveDataMasker.maskedPacket(null));
    }
}
