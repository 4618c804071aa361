package me.golemcore.relay.infrastructure.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BotPropertiesBindingTest {

    private BotProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        properties = new Binder(ConfigurationPropertySources.from(sources))
                .bind("bot", BotProperties.class)
                .get();
    }

    @Test
    void shouldShipKeywordTableVerbatim() {
        Map<String, Integer> keywords = properties.getTrigger().getKeywords();

        assertEquals(11, keywords.size());
        assertEquals(40, keywords.get("rustaris"));
        assertEquals(40, keywords.get("拉斯塔"));
        assertEquals(20, keywords.get("?"));
        assertEquals(20, keywords.get("？"));
        assertEquals(20, keywords.get("吗"));
        assertEquals(10, keywords.get("!"));
        assertEquals(10, keywords.get("！"));
    }

    @Test
    void shouldBoostTwoMessagesAfterReply() {
        BotProperties.TriggerProperties trigger = properties.getTrigger();

        assertEquals(50, trigger.getThreshold());
        assertEquals(30, trigger.getBoostScore());
        assertEquals(2, trigger.getBoostMessages());
    }

    @Test
    void shouldBindScopeBounds() {
        assertEquals(256, properties.getConversation().getMaxLoadedScopes());
        assertEquals(1024, properties.getDispatch().getMaxTrackedScopes());
    }
}
