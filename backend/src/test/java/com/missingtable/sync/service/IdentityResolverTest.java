package com.missingtable.sync.service;

import com.missingtable.sync.dto.MatchMessage;
import com.missingtable.sync.dto.ResolvedReferences;
import com.missingtable.sync.exception.PermanentIngestionException;
import com.missingtable.sync.model.Match;
import com.missingtable.sync.model.MatchSource;
import com.missingtable.sync.model.MatchStatus;
import com.missingtable.sync.repository.MatchRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    @Mock private MatchRepository matchRepository;

    private IdentityResolver resolver;
    private final ResolvedReferences refs = new ResolvedReferences(1L, 2L, 3L, 4L, 5L, null);
    private final LocalDate date = LocalDate.of(2025, 10, 4);
    private final String naturalKey = "2025-10-04|1|2|3|4|5|-";

    @BeforeEach
    void setUp() {
        resolver = new IdentityResolver(matchRepository);
    }

    private MatchMessage message(String externalId) {
        return new MatchMessage("Team A", "Team B", date, "2025-2026", "U14", "League", null,
                MatchStatus.SCHEDULED, null, null, externalId, MatchSource.AUTOMATED);
    }

    private Match stored(Long id, String externalId) {
        Match m = new Match();
        m.setId(id);
        m.setExternalMatchId(externalId);
        m.setStatus(MatchStatus.SCHEDULED);
        m.setSource(MatchSource.MANUAL);
        return m;
    }

    @Test
    void externalIdHitWins() {
        when(matchRepository.findByExternalMatchId("42")).thenReturn(Optional.of(stored(9L, "42")));

        IdentityResolution r = resolver.resolve(message("42"), refs);

        assertThat(r.existing().get().id()).isEqualTo(9L);
        assertThat(r.adoptExternalId()).isFalse();
        verify(matchRepository, never()).findByNaturalKey(anyString());
    }

    @Test
    void externalIdMissFallsBackToNaturalKeyAndAdoptsId() {
        when(matchRepository.findByExternalMatchId("42")).thenReturn(Optional.empty());
        when(matchRepository.findByNaturalKey(naturalKey)).thenReturn(Optional.of(stored(11L, null)));

        IdentityResolution r = resolver.resolve(message("42"), refs);

        assertThat(r.existing()).isPresent();
        assertThat(r.adoptExternalId()).isTrue();
        assertThat(r.naturalKey()).isEqualTo(naturalKey);
    }

    @Test
    void naturalKeyHitWithDifferentExternalIdIsRejected() {
        when(matchRepository.findByExternalMatchId("42")).thenReturn(Optional.empty());
        when(matchRepository.findByNaturalKey(naturalKey)).thenReturn(Optional.of(stored(11L, "77")));

        assertThatThrownBy(() -> resolver.resolve(message("42"), refs))
                .isInstanceOf(PermanentIngestionException.class)
                .hasMessageContaining("77");
    }

    @Test
    void withoutExternalIdOnlyNaturalKeyIsConsulted() {
        when(matchRepository.findByNaturalKey(naturalKey)).thenReturn(Optional.of(stored(11L, "77")));

        IdentityResolution r = resolver.resolve(message(null), refs);

        assertThat(r.existing()).isPresent();
        assertThat(r.adoptExternalId()).isFalse();
        verify(matchRepository, never()).findByExternalMatchId(any());
    }

    @Test
    void nothingFoundMeansCreate() {
        when(matchRepository.findByExternalMatchId("42")).thenReturn(Optional.empty());
        when(matchRepository.findByNaturalKey(naturalKey)).thenReturn(Optional.empty());

        IdentityResolution r = resolver.resolve(message("42"), refs);

        assertThat(r.existing()).isEmpty();
        assertThat(r.naturalKey()).isEqualTo(naturalKey);
    }
}
