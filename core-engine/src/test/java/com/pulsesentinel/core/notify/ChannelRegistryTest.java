package com.pulsesentinel.core.notify;

import com.pulsesentinel.core.model.Channel;
import com.pulsesentinel.core.model.ChannelType;
import com.pulsesentinel.core.testing.Fixtures;
import com.pulsesentinel.core.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ChannelRegistry}.
 */
class ChannelRegistryTest {

    private ChannelRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ChannelRegistry(MutableClock.at("2024-05-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Should generate an id and default the test status to pending")
    void shouldSaveNewChannel() {
        Channel saved = registry.save(Fixtures.channel(null, ChannelType.SLACK, Map.of()));

        assertThat(saved.getId()).startsWith("channel_");
        assertThat(saved.getTestStatus()).isEqualTo(Channel.TEST_PENDING);
        assertThat(registry.list()).hasSize(1);
    }

    @Test
    @DisplayName("Should reject a channel without a type")
    void shouldRequireType() {
        assertThatThrownBy(() -> registry.save(Fixtures.channel("x", null, Map.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should resolve only known, enabled channels in request order")
    void shouldResolveEnabledChannels() {
        registry.save(Fixtures.channel("a", ChannelType.WEBHOOK, Map.of()));
        Channel off = Fixtures.channel("b", ChannelType.EMAIL, Map.of());
        off.setEnabled(false);
        registry.save(off);
        registry.save(Fixtures.channel("c", ChannelType.SMS, Map.of()));

        assertThat(registry.resolve(List.of("c", "missing", "b", "a")))
                .extracting(Channel::getId).containsExactly("c", "a");
    }

    @Test
    @DisplayName("Should hand out copies that do not alias stored state")
    void shouldReturnCopies() {
        registry.save(Fixtures.channel("a", ChannelType.WEBHOOK, Map.of("url", "http://a")));

        Channel copy = registry.get("a").orElseThrow();
        copy.getConfig().put("url", "http://evil");

        assertThat(registry.get("a").orElseThrow().configString("url")).contains("http://a");
    }
}
