package com.uconnect.admissionsBot.academicApi;

import com.uconnect.admissionsBot.academicApi.model.CourseEntry;
import com.uconnect.admissionsBot.academicApi.model.Faculty;
import com.uconnect.admissionsBot.academicApi.model.Program;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Client for the institutional academic API (Academusoft).
 * 
 * Handles:
 * - Faculties (/facultades)
 * - Academic programs (/programasacademicos)
 * - Curriculum by program (/listarpensumporprograma)
 * 
 * Responses are cached per endpoint and filter. Any remote failure falls back to the
 * bundled datasets, so the engine keeps answering while the API is down. Remote rows are
 * passed through {@link AcademicFilters} so both sources filter identically.
 */
@Slf4j
@Primary
@Service
@ConditionalOnProperty(name = "uconnect.academic.source", havingValue = "academusoft")
public class AcademusoftApiClient implements AcademicDataProvider {

    private final LocalAcademicDataService localFallback;
    private final RestClient restClient;
    private final Cache<String, List<?>> responseCache;

    public AcademusoftApiClient(
            LocalAcademicDataService localFallback,
            @Value("${uconnect.academic.academusoft.base-url:http://api-academusoft.appsprod.unicordoba.edu.co/api}") String baseUrl,
            @Value("${uconnect.academic.academusoft.timeout:10s}") Duration timeout,
            @Value("${uconnect.academic.academusoft.cache-ttl:1h}") Duration cacheTtl) {
        this.localFallback = localFallback;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());

        this.restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.responseCache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1_000)
                .build();
    }

    @Override
    public List<Faculty> listFaculties(Map<String, String> filter) {
        return fetch("/facultades", filter,
                () -> AcademicFilters.filterFaculties(get("/facultades", filter, new ParameterizedTypeReference<List<Faculty>>() {}), filter),
                () -> localFallback.listFaculties(filter));
    }

    @Override
    public List<Program> listPrograms(Map<String, String> filter) {
        return fetch("/programasacademicos", filter,
                () -> AcademicFilters.filterPrograms(get("/programasacademicos", filter, new ParameterizedTypeReference<List<Program>>() {}), filter),
                () -> localFallback.listPrograms(filter));
    }

    @Override
    public List<CourseEntry> listCurriculum(Map<String, String> filter) {
        return fetch("/listarpensumporprograma", filter,
                () -> AcademicFilters.filterCurriculum(get("/listarpensumporprograma", filter, new ParameterizedTypeReference<List<CourseEntry>>() {}), filter),
                () -> localFallback.listCurriculum(filter));
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> fetch(String path, Map<String, String> filter, Supplier<List<T>> remote, Supplier<List<T>> fallback) {
        String cacheKey = path + ":" + new TreeMap<>(filter == null ? Map.of() : filter);
        List<T> cached = (List<T>) responseCache.getIfPresent(cacheKey);
        if (cached != null) {
            log.debug("Academusoft cache hit - path: {}, filter: {}", path, filter);
            return cached;
        }
        try {
            List<T> result = remote.get();
            responseCache.put(cacheKey, result);
            log.info("Academusoft API call successful - path: {}, filter: {}, results: {}", path, filter, result.size());
            return result;
        } catch (Exception e) {
            log.warn("Academusoft API call failed, using local data - path: {}, error: {}", path, e.getMessage());
            return fallback.get();
        }
    }

    private <T> List<T> get(String path, Map<String, String> filter, ParameterizedTypeReference<List<T>> type) {
        List<T> body = restClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(path);
                    if (filter != null) {
                        filter.forEach((key, value) -> uriBuilder.queryParam(key, value));
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .onStatus(status -> status.isError(), (req, res) -> {
                    throw new IllegalStateException("Academusoft API call failed with status: " + res.getStatusCode());
                })
                .body(type);
        return body != null ? body : List.of();
    }
}
