package com.slb.fleet_backend.modules.selection.service;

import com.slb.fleet_backend.common.exception.SnapshotExpiredException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.modules.container.service.ContainerService;
import com.slb.fleet_backend.modules.device.service.DeviceRegistryService;
import com.slb.fleet_backend.modules.selection.config.SelectionProperties;
import com.slb.fleet_backend.modules.selection.domain.SelectionSpec;
import com.slb.fleet_backend.modules.selection.enums.TagMatch;
import com.slb.fleet_backend.modules.selection.vo.SelectionSnapshotVo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SelectionResolverTest {

    private static final Long FARM = 1L;
    private static final Long OPERATOR = 7L;

    @Mock
    private DeviceRegistryService deviceRegistryService;
    @Mock
    private ContainerService containerService;
    @Mock
    private SnapshotCacheService snapshotCacheService;

    private SelectionResolver resolver;

    @BeforeEach
    void setup() {
        resolver = new SelectionResolver(deviceRegistryService, containerService, snapshotCacheService, new SelectionProperties());
    }

    @Test
    void explicitIds_keepCallerOrderAndDropDuplicates() {
        List<Long> ids = resolver.resolve(FARM, OPERATOR, SelectionSpec.ofIds(List.of(5L, 3L, 5L, 9L)));

        assertThat(ids).containsExactly(5L, 3L, 9L);
    }

    @Test
    void tags_defaultToAnyAndComeBackSorted() {
        when(deviceRegistryService.findIdsByTags(FARM, List.of(2L, 4L), false)).thenReturn(List.of(30L, 10L, 20L));

        List<Long> ids = resolver.resolve(FARM, OPERATOR, SelectionSpec.ofTags(List.of(2L, 4L), null));

        assertThat(ids).containsExactly(10L, 20L, 30L);
    }

    @Test
    void tags_matchAllPassedThrough() {
        when(deviceRegistryService.findIdsByTags(FARM, List.of(2L, 4L), true)).thenReturn(List.of(10L));

        assertThat(resolver.resolve(FARM, OPERATOR, SelectionSpec.ofTags(List.of(2L, 4L), TagMatch.ALL)))
                .containsExactly(10L);
    }

    @Test
    void container_delegatesToContainerService() {
        when(containerService.resolveMembers(FARM, 8L)).thenReturn(List.of(1L, 2L));

        assertThat(resolver.resolve(FARM, OPERATOR, SelectionSpec.ofContainer(8L))).containsExactly(1L, 2L);
    }

    @Test
    void snapshot_isReturnedVerbatimForItsOwner() {
        String searchId = "0123456789abcdef0123456789abcdef";
        when(snapshotCacheService.load(OPERATOR, searchId)).thenReturn(List.of(9L, 1L, 5L));
        SelectionSpec spec = new SelectionSpec();
        spec.setSearchId(searchId);

        assertThat(resolver.resolve(FARM, OPERATOR, spec)).containsExactly(9L, 1L, 5L);
    }

    @Test
    void snapshot_expiredPropagates() {
        String searchId = "0123456789abcdef0123456789abcdef";
        when(snapshotCacheService.load(OPERATOR, searchId)).thenThrow(new SnapshotExpiredException(searchId));
        SelectionSpec spec = new SelectionSpec();
        spec.setSearchId(searchId);

        SnapshotExpiredException ex = assertThrows(SnapshotExpiredException.class, () -> resolver.resolve(FARM, OPERATOR, spec));
        assertThat(ex.getCode()).isEqualTo(410);
    }

    @Test
    void validate_rejectsNoneOrSeveralKinds() {
        assertThrows(ValidationException.class, () -> resolver.resolve(FARM, OPERATOR, new SelectionSpec()));

        SelectionSpec both = SelectionSpec.ofIds(List.of(1L));
        both.setContainerId(3L);
        ValidationException ex = assertThrows(ValidationException.class, () -> resolver.resolve(FARM, OPERATOR, both));
        assertThat(ex.getFieldErrors()).containsKey("target");
    }

    @Test
    void validate_rejectsEmptyIds() {
        assertThrows(ValidationException.class, () -> resolver.resolve(FARM, OPERATOR, SelectionSpec.ofIds(List.of())));
    }

    @Test
    void snapshot_cachesResolvedIds() {
        when(snapshotCacheService.cacheSnapshot(OPERATOR, List.of(4L, 2L))).thenReturn("abc");
        when(snapshotCacheService.ttlSeconds()).thenReturn(600L);

        SelectionSnapshotVo vo = resolver.snapshot(FARM, OPERATOR, SelectionSpec.ofIds(List.of(4L, 2L)));

        assertThat(vo.getSearchId()).isEqualTo("abc");
        assertThat(vo.getCount()).isEqualTo(2);
        verify(snapshotCacheService).cacheSnapshot(OPERATOR, List.of(4L, 2L));
    }
}
