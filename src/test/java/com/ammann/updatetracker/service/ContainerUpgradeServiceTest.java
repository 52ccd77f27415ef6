/* (C)2026 */
package com.ammann.updatetracker.service;

import static com.ammann.updatetracker.service.UpdateOrchestrator.CONTAINERS_KEY;
import static com.ammann.updatetracker.support.Injection.injectField;
import static com.ammann.updatetracker.support.TrackedItems.CHECKED_AT;
import static com.ammann.updatetracker.support.TrackedItems.NEWER_DIGEST;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.updatetracker.cache.CacheStore;
import com.ammann.updatetracker.cache.InMemoryCacheRepository;
import com.ammann.updatetracker.config.DockerClientRegistry;
import com.ammann.updatetracker.exception.ServiceBlacklistedException;
import com.ammann.updatetracker.exception.UpgradeFailedException;
import com.ammann.updatetracker.model.CacheMetadata;
import com.ammann.updatetracker.model.ContainerPayload;
import com.ammann.updatetracker.model.TrackedItem;
import com.ammann.updatetracker.support.TestTrackerConfig;
import com.ammann.updatetracker.support.TrackedItems;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerCmd;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.ListContainersCmd;
import com.github.dockerjava.api.command.PullImageCmd;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.DockerClientException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerConfig;
import com.github.dockerjava.api.model.ContainerHostConfig;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Ports;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

@DisplayName("ContainerUpgradeService")
class ContainerUpgradeServiceTest {

    private static final String OLD_ID = "aaaaaaaaaaaa1111";
    private static final String NEW_ID = "bbbbbbbbbbbb2222";
    private static final String IMAGE = "nginx:1.25";
    private static final String NEW_IMAGE_ID = "sha256:newimage";
    private static final String DEP_ID = "dddddddddddd3333";
    private static final String DEP_NEW_ID = "eeeeeeeeeeee4444";
    private static final String DEP_IMAGE = "qbittorrent:4.6";

    ContainerUpgradeService service;
    TestTrackerConfig config;
    CacheStore cacheStore;
    DockerClient client;
    PullImageCmd pullCmd;
    ListContainersCmd listCmd;

    @BeforeEach
    void setUp() {
        config = new TestTrackerConfig();

        cacheStore = new CacheStore();
        injectField(cacheStore, "repository", new InMemoryCacheRepository());
        injectField(cacheStore, "logger", mock(Logger.class));

        client = mock(DockerClient.class, RETURNS_DEEP_STUBS);
        DockerClientRegistry clientRegistry = mock(DockerClientRegistry.class);
        when(clientRegistry.clientFor("alpha")).thenReturn(client);

        ContainerConfig containerConfig = mock(ContainerConfig.class);
        when(containerConfig.getImage()).thenReturn(IMAGE);
        when(containerConfig.getEnv()).thenReturn(new String[] {"TZ=UTC"});
        InspectContainerResponse oldInfo = mock(InspectContainerResponse.class);
        when(oldInfo.getConfig()).thenReturn(containerConfig);
        when(oldInfo.getId()).thenReturn(OLD_ID);
        when(oldInfo.getName()).thenReturn("/web");
        InspectContainerCmd inspectOld = mock(InspectContainerCmd.class);
        when(inspectOld.exec()).thenReturn(oldInfo);
        when(client.inspectContainerCmd(OLD_ID)).thenReturn(inspectOld);

        InspectContainerResponse newInfo = mock(InspectContainerResponse.class);
        when(newInfo.getImageId()).thenReturn(NEW_IMAGE_ID);
        InspectContainerCmd inspectNew = mock(InspectContainerCmd.class);
        when(inspectNew.exec()).thenReturn(newInfo);
        when(client.inspectContainerCmd(NEW_ID)).thenReturn(inspectNew);

        pullCmd = mock(PullImageCmd.class);
        when(client.pullImageCmd(IMAGE)).thenReturn(pullCmd);
        when(pullCmd.exec(any())).thenReturn(mock(PullImageResultCallback.class));

        listCmd = mock(ListContainersCmd.class);
        when(client.listContainersCmd()).thenReturn(listCmd);
        when(listCmd.exec()).thenReturn(List.of());

        when(client.createContainerCmd(IMAGE).withName("web").exec().getId()).thenReturn(NEW_ID);
        when(client.inspectImageCmd(NEW_IMAGE_ID).exec().getRepoDigests())
                .thenReturn(List.of("nginx@" + NEWER_DIGEST));

        service = new ContainerUpgradeService();
        injectField(service, "clientRegistry", clientRegistry);
        injectField(service, "cacheStore", cacheStore);
        injectField(service, "config", config);
        injectField(service, "logger", mock(Logger.class));
    }

    private void seed(TrackedItem... items) {
        cacheStore.merge(
                CONTAINERS_KEY,
                new ContainerPayload(List.of(items), Map.of()),
                CacheMetadata.full(CHECKED_AT));
    }

    private static Container running(String id, String name, String networkMode) {
        ContainerHostConfig hostConfig = mock(ContainerHostConfig.class);
        when(hostConfig.getNetworkMode()).thenReturn(networkMode);
        Container container = mock(Container.class);
        when(container.getId()).thenReturn(id);
        when(container.getNames()).thenReturn(new String[] {name});
        when(container.getHostConfig()).thenReturn(hostConfig);
        return container;
    }

    /** Registers a torrent client running in the network namespace of {@code web}. */
    private CreateContainerCmd dependentOnWeb() {
        HostConfig hostConfig =
                HostConfig.newHostConfig()
                        .withNetworkMode("container:web")
                        .withPortBindings(
                                new Ports(ExposedPort.tcp(8080), Ports.Binding.bindPort(8080)))
                        .withPublishAllPorts(true);
        ContainerConfig containerConfig = mock(ContainerConfig.class);
        when(containerConfig.getImage()).thenReturn(DEP_IMAGE);
        InspectContainerResponse info = mock(InspectContainerResponse.class);
        when(info.getId()).thenReturn(DEP_ID);
        when(info.getName()).thenReturn("/torrent");
        when(info.getConfig()).thenReturn(containerConfig);
        when(info.getHostConfig()).thenReturn(hostConfig);
        InspectContainerCmd inspect = mock(InspectContainerCmd.class);
        when(inspect.exec()).thenReturn(info);
        when(client.inspectContainerCmd(DEP_ID)).thenReturn(inspect);

        CreateContainerResponse created = mock(CreateContainerResponse.class);
        when(created.getId()).thenReturn(DEP_NEW_ID);
        CreateContainerCmd createCmd = mock(CreateContainerCmd.class, RETURNS_SELF);
        when(createCmd.exec()).thenReturn(created);
        when(client.createContainerCmd(DEP_IMAGE)).thenReturn(createCmd);
        return createCmd;
    }

    @Test
    @DisplayName("should pull, recreate and start the container")
    void shouldRecreateContainer() {
        String newId = service.upgrade("alpha", OLD_ID);

        assertThat(newId).isEqualTo(NEW_ID);
        InOrder order = inOrder(client);
        order.verify(client).pullImageCmd(IMAGE);
        order.verify(client).stopContainerCmd(OLD_ID);
        order.verify(client).removeContainerCmd(OLD_ID);
        order.verify(client).startContainerCmd(NEW_ID);
    }

    @Test
    @DisplayName("should move the cached record to the new container and clear its update")
    void shouldMoveCachedRecord() {
        seed(TrackedItems.withUpdate("alpha", OLD_ID, "web"));

        service.upgrade("alpha", OLD_ID);

        List<TrackedItem> items = cacheStore.get(CONTAINERS_KEY).orElseThrow().payload().items();
        assertThat(items).singleElement().satisfies(
                item -> {
                    assertThat(item.id()).isEqualTo(NEW_ID);
                    assertThat(item.currentDigest()).isEqualTo(NEWER_DIGEST);
                    assertThat(item.hasUpdateAvailable()).isFalse();
                    assertThat(item.registryCheckedAt()).isEqualTo(CHECKED_AT);
                });
        assertThat(cacheStore.get(CONTAINERS_KEY).orElseThrow().metadata())
                .isEqualTo(CacheMetadata.full(CHECKED_AT));
    }

    @Nested
    @DisplayName("shared network namespaces")
    class SharedNetwork {

        @Test
        @DisplayName("should remove dependents first and recreate them on the new container")
        void shouldRecreateDependentsOnNewContainer() {
            CreateContainerCmd dependentCreate = dependentOnWeb();
            List<Container> containers =
                    List.of(
                            running(OLD_ID, "/web", "bridge"),
                            running(DEP_ID, "/torrent", "container:web"),
                            running("ffffffffffff5555", "/db", "container:proxy"));
            when(listCmd.exec()).thenReturn(containers);

            service.upgrade("alpha", OLD_ID);

            InOrder order = inOrder(client);
            order.verify(client).stopContainerCmd(DEP_ID);
            order.verify(client).removeContainerCmd(DEP_ID);
            order.verify(client).stopContainerCmd(OLD_ID);
            order.verify(client).removeContainerCmd(OLD_ID);
            order.verify(client).startContainerCmd(NEW_ID);
            order.verify(client).startContainerCmd(DEP_NEW_ID);
            verify(client, never()).inspectContainerCmd("ffffffffffff5555");
            verify(client, never()).removeContainerCmd("ffffffffffff5555");

            ArgumentCaptor<HostConfig> hostConfig = ArgumentCaptor.forClass(HostConfig.class);
            verify(dependentCreate).withName("torrent");
            verify(dependentCreate).withHostConfig(hostConfig.capture());
            assertThat(hostConfig.getValue().getNetworkMode()).isEqualTo("container:" + NEW_ID);
            assertThat(hostConfig.getValue().getPortBindings()).isNull();
            assertThat(hostConfig.getValue().getPublishAllPorts()).isNull();
        }

        @Test
        @DisplayName("should move the cached records of recreated dependents")
        void shouldMoveDependentRecords() {
            dependentOnWeb();
            List<Container> containers = List.of(running(DEP_ID, "/torrent", "service:web"));
            when(listCmd.exec()).thenReturn(containers);
            seed(
                    TrackedItems.withUpdate("alpha", OLD_ID, "web"),
                    TrackedItems.withUpdate("alpha", DEP_ID, "torrent"));

            service.upgrade("alpha", OLD_ID);

            List<TrackedItem> items =
                    cacheStore.get(CONTAINERS_KEY).orElseThrow().payload().items();
            assertThat(items)
                    .extracting(TrackedItem::name, TrackedItem::id)
                    .containsExactlyInAnyOrder(
                            tuple("web", NEW_ID), tuple("torrent", DEP_NEW_ID));
            assertThat(items)
                    .filteredOn(item -> item.name().equals("torrent"))
                    .singleElement()
                    .satisfies(item -> assertThat(item.hasUpdateAvailable()).isTrue());
        }

        @Test
        @DisplayName("should still upgrade when a dependent cannot be recreated")
        void shouldUpgradeWhenDependentFails() {
            CreateContainerCmd dependentCreate = dependentOnWeb();
            when(dependentCreate.exec()).thenThrow(new DockerClientException("name in use"));
            List<Container> containers =
                    List.of(running(DEP_ID, "/torrent", "container:" + OLD_ID));
            when(listCmd.exec()).thenReturn(containers);

            assertThat(service.upgrade("alpha", OLD_ID)).isEqualTo(NEW_ID);
            verify(client).removeContainerCmd(DEP_ID);
        }

        @Test
        @DisplayName("should drop published ports from a container joining another namespace")
        void shouldDropPublishedPortsForSharedMode() {
            HostConfig original =
                    HostConfig.newHostConfig()
                            .withNetworkMode("container:vpn")
                            .withPortBindings(
                                    new Ports(ExposedPort.tcp(80), Ports.Binding.bindPort(8081)));

            HostConfig prepared = ContainerUpgradeService.hostConfigFor(original, null);

            assertThat(prepared.getNetworkMode()).isEqualTo("container:vpn");
            assertThat(prepared.getPortBindings()).isNull();
        }

        @Test
        @DisplayName("should keep published ports on ordinary networks")
        void shouldKeepPublishedPortsOnOrdinaryNetworks() {
            Ports ports = new Ports(ExposedPort.tcp(80), Ports.Binding.bindPort(8081));
            HostConfig original =
                    HostConfig.newHostConfig().withNetworkMode("bridge").withPortBindings(ports);

            HostConfig prepared = ContainerUpgradeService.hostConfigFor(original, null);

            assertThat(prepared.getPortBindings()).isSameAs(ports);
        }
    }

    @Test
    @DisplayName("should refuse blacklisted containers before touching them")
    void shouldRefuseBlacklistedContainers() {
        config.blacklist = new HashSet<>(Set.of("web"));

        assertThatThrownBy(() -> service.upgrade("alpha", OLD_ID))
                .isInstanceOf(ServiceBlacklistedException.class)
                .hasMessageContaining(OLD_ID);
        verify(client, never()).pullImageCmd(any());
        verify(client, never()).stopContainerCmd(any());
    }

    @Test
    @DisplayName("should wrap Docker failures and leave the cache alone")
    void shouldWrapDockerFailures() {
        seed(TrackedItems.withUpdate("alpha", OLD_ID, "web"));
        when(pullCmd.exec(any())).thenThrow(new DockerClientException("pull failed"));

        assertThatThrownBy(() -> service.upgrade("alpha", OLD_ID))
                .isInstanceOfSatisfying(
                        UpgradeFailedException.class,
                        e -> assertThat(e.getContainerName()).isEqualTo("web"));
        verify(client, never()).removeContainerCmd(any());
        assertThat(cacheStore.get(CONTAINERS_KEY).orElseThrow().payload().items().get(0).id())
                .isEqualTo(OLD_ID);
    }
}
