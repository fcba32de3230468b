package com.uconnect.admissionsBot.academicApi;

import com.uconnect.admissionsBot.academicApi.model.Faculty;
import com.uconnect.admissionsBot.orchestrator.model.QueryParams;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AcademusoftApiClientTest {

    @Mock
    private LocalAcademicDataService localFallback;

    @Test
    void listFaculties_shouldFallBackToLocalDataWhenApiIsUnreachable() {
        // nothing listens on port 9
        AcademusoftApiClient client = new AcademusoftApiClient(
                localFallback, "http://127.0.0.1:9/api", Duration.ofMillis(500), Duration.ofHours(1));
        Map<String, String> filter = Map.of(QueryParams.NAME, "ingenierias");
        List<Faculty> local = List.of(Faculty.builder().id("10").name("FACULTAD DE INGENIERIAS").build());
        when(localFallback.listFaculties(filter)).thenReturn(local);

        assertThat(client.listFaculties(filter)).isEqualTo(local);
        assertThat(client.listFaculties(filter)).isEqualTo(local);

        // fallback results are not cached, the API is retried on the next call
        verify(localFallback, times(2)).listFaculties(filter);
    }
}
