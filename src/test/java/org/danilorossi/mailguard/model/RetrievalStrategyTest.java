package org.danilorossi.mailguard.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.danilorossi.mailguard.model.RetrievalStrategy.Kind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetrievalStrategyTest {

  @Test
  @DisplayName("Nomi accettati da riga di comando")
  void parseKind() {
    assertThat(RetrievalStrategy.parseKind("all")).isEqualTo(Kind.ALL);
    assertThat(RetrievalStrategy.parseKind(" Recent ")).isEqualTo(Kind.RECENT);
    assertThat(RetrievalStrategy.parseKind("hybrid")).isEqualTo(Kind.DEFAULT);
    assertThat(RetrievalStrategy.parseKind("pop")).isNull();
  }

  @Test
  @DisplayName("Finestre prese dalla configurazione")
  void fromConfig() {
    MonitorConfig cfg = MonitorConfig.builder().recentDaysBack(3).unreadDaysBack(5).readDaysBack(1).build();

    assertThat(cfg.strategyOf(Kind.RECENT).getDaysBack()).isEqualTo(3);
    assertThat(cfg.tickStrategy().getKind()).isEqualTo(Kind.DEFAULT);
    assertThat(cfg.tickStrategy().getDaysBack()).isEqualTo(5);
    assertThat(cfg.tickStrategy().getReadDaysBack()).isEqualTo(1);
  }

  @Test
  void rejectsEmptyWindows() {
    assertThatThrownBy(() -> RetrievalStrategy.recent(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
