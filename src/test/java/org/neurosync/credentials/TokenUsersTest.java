package org.neurosync.credentials;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TokenUsersTest {

    static String jwt(String payloadJson) {
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        return encoder.encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8))
            + "." + encoder.encodeToString(payloadJson.getBytes(StandardCharsets.UTF_8))
            + ".sig";
    }

    @Test
    void claimedUser_prefersUserOverEmail() {
        assertThat(TokenUsers.claimedUser(jwt("{\"user\":\"alice\",\"email\":\"a@example.org\"}"))).hasValue("alice");
        assertThat(TokenUsers.claimedUser(jwt("{\"email\":\"a@example.org\"}"))).hasValue("a@example.org");
        assertThat(TokenUsers.claimedUser(jwt("{\"sub\":\"1\"}"))).isEmpty();
    }

    @Test
    void claimedUser_opaqueTokensNameNobody() {
        assertThat(TokenUsers.claimedUser("opaque")).isEmpty();
        assertThat(TokenUsers.claimedUser("a.%%%.c")).isEmpty();
        assertThat(TokenUsers.claimedUser(null)).isEmpty();
    }

    @Test
    void userFromToken_fallsBackToDefault() {
        assertThat(TokenUsers.userFromToken("opaque", "bob")).hasValue("bob");
        assertThat(TokenUsers.userFromToken(null, null)).isEmpty();
    }

    @Test
    void userFromToken_agreeingOrConflictingDefault() {
        String token = jwt("{\"user\":\"alice\"}");

        assertThat(TokenUsers.userFromToken(token, null)).hasValue("alice");
        assertThat(TokenUsers.userFromToken(token, "alice")).hasValue("alice");
        assertThat(TokenUsers.userFromToken(token, "bob")).isEmpty();
    }
}
