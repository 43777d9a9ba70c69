package org.lokray.ferra.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserConfigTest
{
	@AfterEach
	void clearOverrides()
	{
		System.clearProperty(ParserConfig.TAB_WIDTH);
	}

	@Test
	@DisplayName("should fall back to defaults for missing settings")
	void defaults()
	{
		ParserConfig config = ParserConfig.defaults();
		assertThat(config.getTabWidth()).isEqualTo(4);
		assertThat(config.getMaxDiagnostics()).isZero();
		assertThat(config.getGlrLookaheadLimit()).isEqualTo(64);
		assertThat(config.isTraceEnabled()).isFalse();
	}

	@Test
	@DisplayName("should read every setting from properties")
	void customSettings()
	{
		Properties props = new Properties();
		props.setProperty(ParserConfig.TAB_WIDTH, "8");
		props.setProperty(ParserConfig.MAX_DIAGNOSTICS, " 25 ");
		props.setProperty(ParserConfig.GLR_LOOKAHEAD_LIMIT, "16");
		props.setProperty(ParserConfig.DEBUG_TRACE, "true");
		ParserConfig config = new ParserConfig(props);
		assertThat(config.getTabWidth()).isEqualTo(8);
		assertThat(config.getMaxDiagnostics()).isEqualTo(25);
		assertThat(config.getGlrLookaheadLimit()).isEqualTo(16);
		assertThat(config.isTraceEnabled()).isTrue();
	}

	@Test
	@DisplayName("should reject values that are not integers")
	void rejectsGarbage()
	{
		Properties props = new Properties();
		props.setProperty(ParserConfig.TAB_WIDTH, "wide");
		assertThatThrownBy(() -> new ParserConfig(props))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("lexer.tabWidth");
	}

	@Test
	@DisplayName("should reject values below the minimum")
	void rejectsTooSmall()
	{
		Properties props = new Properties();
		props.setProperty(ParserConfig.MAX_DIAGNOSTICS, "-1");
		assertThatThrownBy(() -> new ParserConfig(props))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Property 'diagnostics.max' must be at least 0, got -1");
	}

	@Test
	@DisplayName("should load the bundled file and let system properties override it")
	void loadWithOverride()
	{
		assertThat(ParserConfig.load().getTabWidth()).isEqualTo(4);
		System.setProperty(ParserConfig.TAB_WIDTH, "2");
		assertThat(ParserConfig.load().getTabWidth()).isEqualTo(2);
	}
}
