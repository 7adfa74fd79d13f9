package fr.lapetina.hashlb.domain.hashing;

import fr.lapetina.hashlb.domain.model.Host;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashKeyPolicyTest {

    private final HashKeyPolicy byAddress = HashKeyPolicy.defaults();
    private final HashKeyPolicy byHostname = new HashKeyPolicy(true, "lb", "hash_key");

    @Test
    @DisplayName("should prefer the metadata override")
    void shouldPreferMetadataOverride() {
        Host host = Host.builder()
                .address("10.0.0.1:80")
                .hostname("app-1")
                .addMetadata("lb", "hash_key", "stable-key")
                .build();

        assertThat(byAddress.hashKey(host)).isEqualTo("stable-key");
        assertThat(byHostname.hashKey(host)).isEqualTo("stable-key");
    }

    @Test
    @DisplayName("should use hostname only when configured and present")
    void shouldUseHostnameWhenConfigured() {
        Host named = Host.builder().address("10.0.0.1:80").hostname("app-1").build();
        Host unnamed = Host.builder().address("10.0.0.2:80").build();

        assertThat(byHostname.hashKey(named)).isEqualTo("app-1");
        assertThat(byHostname.hashKey(unnamed)).isEqualTo("10.0.0.2:80");
        assertThat(byAddress.hashKey(named)).isEqualTo("10.0.0.1:80");
    }

    @Test
    @DisplayName("should ignore a non-string override and fall through")
    void shouldIgnoreNonStringOverride() {
        Host host = Host.builder()
                .address("10.0.0.1:80")
                .hostname("app-1")
                .addMetadata("lb", "hash_key", 42)
                .build();

        assertThat(byHostname.hashKey(host)).isEqualTo("app-1");
        assertThat(byAddress.hashKey(host)).isEqualTo("10.0.0.1:80");
    }

    @Test
    @DisplayName("should ignore an empty override")
    void shouldIgnoreEmptyOverride() {
        Host host = Host.builder()
                .address("10.0.0.1:80")
                .addMetadata("lb", "hash_key", "")
                .build();

        assertThat(byAddress.hashKey(host)).isEqualTo("10.0.0.1:80");
    }

    @Test
    @DisplayName("should read the override from the configured location")
    void shouldReadConfiguredLocation() {
        HashKeyPolicy custom = new HashKeyPolicy(false, "routing", "key");
        Host host = Host.builder()
                .address("10.0.0.1:80")
                .addMetadata("lb", "hash_key", "ignored")
                .addMetadata("routing", "key", "custom")
                .build();

        assertThat(custom.hashKey(host)).isEqualTo("custom");
    }

    @Test
    @DisplayName("should reject blank metadata location")
    void shouldRejectBlankLocation() {
        assertThatThrownBy(() -> new HashKeyPolicy(false, " ", "key"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HashKeyPolicy(false, "lb", ""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
