package com.slb.fleet_backend.modules.selection.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.fleet_backend.common.exception.SnapshotExpiredException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.common.service.RedisService;
import com.slb.fleet_backend.modules.selection.config.SelectionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SnapshotCacheServiceTest {

    @Mock
    private RedisService redisService;

    private SnapshotCacheService service;

    @BeforeEach
    void setup() {
        SelectionProperties properties = new SelectionProperties();
        properties.setSnapshotTtl(Duration.ofMinutes(3));
        service = new SnapshotCacheService(redisService, new JsonColumnService(new ObjectMapper()), properties);
    }

    @Test
    void cacheSnapshot_writesOwnerScopedKeyWithTtl() {
        String searchId = service.cacheSnapshot(7L, List.of(3L, 1L));

        assertThat(searchId).matches("[0-9a-f]{32}");
        ArgumentCaptor<String> value = ArgumentCaptor.forClass(String.class);
        verify(redisService).set(eq("fleet:selection:7:" + searchId), value.capture(), eq(Duration.ofMinutes(3)));
        assertThat(value.getValue()).isEqualTo("[3,1]");
        assertThat(service.ttlSeconds()).isEqualTo(180L);
    }

    @Test
    void load_returnsStoredOrder() {
        String searchId = "0123456789abcdef0123456789abcdef";
        when(redisService.get("fleet:selection:7:" + searchId)).thenReturn("[9,2,5]");

        assertThat(service.load(7L, searchId)).containsExactly(9L, 2L, 5L);
    }

    @Test
    void load_missingKey_isExpired() {
        String searchId = "0123456789abcdef0123456789abcdef";
        when(redisService.get("fleet:selection:8:" + searchId)).thenReturn(null);

        assertThrows(SnapshotExpiredException.class, () -> service.load(8L, searchId));
    }

    @Test
    void load_malformedId_isValidationError() {
        assertThrows(ValidationException.class, () -> service.load(7L, "not-a-search-id"));
    }
}
