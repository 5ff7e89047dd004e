package com.codeforge.orchestrator.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentTypeTest {

    @Test
    void fromWireName_isCaseInsensitive() {
        assertThat(AgentType.fromWireName("Pipeline")).isEqualTo(AgentType.PIPELINE);
        assertThat(AgentType.fromWireName(" qa ")).isEqualTo(AgentType.QA);
    }

    @Test
    void fromWireName_unknown_throws() {
        assertThatThrownBy(() -> AgentType.fromWireName("deploy"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("deploy");
    }

    @Test
    void providerRouting() {
        assertThat(AgentType.RESEARCH.provider()).isEqualTo("openai");
        assertThat(AgentType.WIREFRAME.provider()).isEqualTo("openai");
        assertThat(AgentType.QA.provider()).isEqualTo("openai");
        assertThat(AgentType.CODE.provider()).isEqualTo("google");
        assertThat(AgentType.PEDAGOGY.provider()).isEqualTo("anthropic");
        assertThat(AgentType.ROADMAP.provider()).isEqualTo("anthropic");
    }
}
