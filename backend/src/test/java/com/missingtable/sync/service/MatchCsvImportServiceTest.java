package com.missingtable.sync.service;

import com.missingtable.sync.dto.ImportRunSummaryDTO;
import com.missingtable.sync.model.ImportError;
import com.missingtable.sync.model.MatchSource;
import com.missingtable.sync.repository.ImportErrorRepository;
import com.missingtable.sync.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class MatchCsvImportServiceTest {

    @Autowired private MatchCsvImportService service;
    @Autowired private ImportErrorRepository importErrorRepository;
    @Autowired private JdbcTemplate jdbcTemplate;

    private TestDatabase db;

    @BeforeEach
    void setUp() {
        db = new TestDatabase(jdbcTemplate);
        db.reset();
        db.seedStandard();
    }

    @Test
    void importsRowsAndCountsOutcomes() throws Exception {
        String csv = "home_team,away_team,date,season,age_group,match_type,status,score_home,score_away,division\n"
                + "Team A,Team B,2025-10-04,2025-2026,U14,League,completed,2,1,Northeast\n"
                + "Team B,Team C,2025-10-11,2025-2026,U14,League,scheduled,,,Northeast\n"
                + "Team A,Team B,2025-10-04,2025-2026,U14,League,completed,2,1,Northeast\n";
        MockMultipartFile file = new MockMultipartFile("file", "fall.csv", "text/csv", csv.getBytes(StandardCharsets.UTF_8));

        ImportRunSummaryDTO dto = service.importCsv(file, MatchSource.MANUAL, "registrar");

        assertThat(dto.getStatus()).isEqualTo("COMPLETED");
        assertThat(dto.getRowsTotal()).isEqualTo(3);
        assertThat(dto.getCreated()).isEqualTo(2);
        // manual rows always re-apply
        assertThat(dto.getUpdated()).isEqualTo(1);
        assertThat(dto.getFailed()).isZero();
        assertThat(db.count("matches")).isEqualTo(2);
    }

    @Test
    void badRowsAreLoggedWithTheirDeadLetter() throws Exception {
        String csv = "home_team,away_team,match_date,season,age_group,match_type,match_status,source\n"
                + "Team A,Team B,2025-10-04,2025-2026,U14,League,scheduled,match-scraper\n"
                + "Team A,Team A,2025-10-05,2025-2026,U14,League,scheduled,match-scraper\n"
                + "Team C,Team B,not-a-date,2025-2026,U14,League,scheduled,match-scraper\n";

        ImportRunSummaryDTO dto = service.importCsv(csv, "mixed.csv", MatchSource.AUTOMATED, null);

        assertThat(dto.getStatus()).isEqualTo("COMPLETED_WITH_ERRORS");
        assertThat(dto.getCreated()).isEqualTo(1);
        assertThat(dto.getFailed()).isEqualTo(2);
        assertThat(dto.getErrors()).hasSize(2);

        List<ImportError> errors = importErrorRepository.findByImportRunId(dto.getId());
        assertThat(errors).hasSize(2);
        assertThat(errors).extracting(ImportError::getRowNumber).containsExactlyInAnyOrder(3, 4);
        assertThat(errors).allSatisfy(e -> assertThat(e.getDeadLetterId()).isNotNull());
        assertThat(db.count("dead_letter_messages")).isEqualTo(2);
    }

    @Test
    void unterminatedQuoteClosesTheRunAsFailed() throws Exception {
        String csv = "home_team,away_team,match_date,season,age_group,match_type,match_status,source\n"
                + "Team A,Team B,2025-10-04,2025-2026,U14,League,scheduled,match-scraper\n"
                + "Team B,\"Team C,2025-10-11,2025-2026,U14,League,scheduled,match-scraper\n";

        ImportRunSummaryDTO dto = service.importCsv(csv, "broken.csv", MatchSource.AUTOMATED, null);

        assertThat(dto.getStatus()).isEqualTo("FAILED");
        assertThat(dto.getCreated()).isEqualTo(1);
        assertThat(dto.getFinishedAt()).isNotNull();
        assertThat(dto.getErrors()).hasSize(1);
        assertThat(dto.getErrors().get(0)).contains("CSV parsing stopped after row 2");
        String stored = jdbcTemplate.queryForObject("SELECT status FROM import_runs WHERE id = ?", String.class, dto.getId());
        assertThat(stored).isEqualTo("FAILED");
        assertThat(importErrorRepository.findByImportRunId(dto.getId()))
                .extracting(ImportError::getRowNumber).containsExactly(3);
    }

    @Test
    void emptyUploadIsRejected() {
        MockMultipartFile empty = new MockMultipartFile("file", "empty.csv", "text/csv", new byte[0]);

        assertThatThrownBy(() -> service.importCsv(empty, MatchSource.MANUAL, "registrar"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
