package me.golemcore.courier.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class HelpTextProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsBundledHelpText() {
        HelpTextProvider provider = new HelpTextProvider(new BotProperties(), new DefaultResourceLoader());

        String text = provider.getHelpText();

        assertTrue(text.contains("add @user <seconds> <message>"));
    }

    @Test
    void returnsFileContentUnmodified() throws IOException {
        Path help = tempDir.resolve("help.txt");
        Files.writeString(help, "  line one\n\n*line two*  \n");
        BotProperties properties = new BotProperties();
        properties.getHelp().setPath(help.toUri().toString());

        HelpTextProvider provider = new HelpTextProvider(properties, new DefaultResourceLoader());

        assertEquals("  line one\n\n*line two*  \n", provider.getHelpText());
    }

    @Test
    void missingResourceYieldsEmptyText() {
        BotProperties properties = new BotProperties();
        properties.getHelp().setPath("classpath:does-not-exist.txt");

        HelpTextProvider provider = new HelpTextProvider(properties, new DefaultResourceLoader());

        assertEquals("", provider.getHelpText());
    }
}
