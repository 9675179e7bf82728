package com.example.spimex.topology;

import com.example.spimex.config.ConnectionSettingsResolver;
import com.example.spimex.config.DatabaseDsn;
import com.example.spimex.exception.InvalidConnectionSettingsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.PropertySourcesPropertyResolver;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a deployment descriptor against the invariants the services rely on.
 * <p>
 * Every rule runs; the result lists all violations rather than stopping at the first.
 */
@Slf4j
@Component
public class TopologyValidator {

    static final String DEFAULT_PGDATA = "/var/lib/postgresql/data";
    static final List<String> BROKER_URL_KEYS = List.of("REDIS_URL", "CELERY_BROKER_URL", "BROKER_URL", "SPRING_DATA_REDIS_URL");
    static final List<String> BROKER_HOST_KEYS = List.of("REDIS_HOST", "SPRING_DATA_REDIS_HOST");
    static final Set<String> DISCRETE_KEYS = Set.of(
            ConnectionSettingsResolver.HOST, ConnectionSettingsResolver.PORT, ConnectionSettingsResolver.NAME,
            ConnectionSettingsResolver.USER, ConnectionSettingsResolver.PASSWORD);

    private enum ConnectionShape { DSN, DISCRETE, BOTH }

    public List<TopologyViolation> validate(DeploymentTopology topology) {
        var violations = new ArrayList<TopologyViolation>();
        checkDependencies(topology, violations);
        checkVolumes(topology, violations);
        checkStorePersistence(topology, violations);
        checkBrokerHosts(topology, violations);
        checkConnectionSettings(topology, violations);
        checkApiStartupOrder(topology, violations);
        checkSchedulerSingleton(topology, violations);
        return violations;
    }

    private void checkDependencies(DeploymentTopology topology, List<TopologyViolation> violations) {
        for (var service : topology.getServices().values()) {
            for (var dependency : service.getDependsOn()) {
                if (!topology.getServices().containsKey(dependency)) {
                    violations.add(TopologyViolation.error(ViolationType.DANGLING_DEPENDENCY, service.getName(),
                            "depends on undeclared service '" + dependency + "'"));
                }
            }
        }
    }

    private void checkVolumes(DeploymentTopology topology, List<TopologyViolation> violations) {
        var mountedBy = new LinkedHashMap<String, List<String>>();
        for (var service : topology.getServices().values()) {
            for (var mount : service.getVolumes()) {
                if (!mount.isNamed()) {
                    continue;
                }
                if (!topology.getVolumes().containsKey(mount.getSource())) {
                    violations.add(TopologyViolation.error(ViolationType.UNDECLARED_VOLUME, service.getName(),
                            "mounts undeclared volume '" + mount.getSource() + "'"));
                }
                mountedBy.computeIfAbsent(mount.getSource(), key -> new ArrayList<>()).add(service.getName());
            }
        }

        mountedBy.forEach((volume, services) -> {
            var distinct = services.stream().distinct().toList();
            if (distinct.size() > 1) {
                violations.add(TopologyViolation.error(ViolationType.SHARED_VOLUME, String.join(",", distinct),
                        "volume '" + volume + "' is mounted by " + distinct.size() + " services"));
            }
        });
    }

    private void checkStorePersistence(DeploymentTopology topology, List<TopologyViolation> violations) {
        for (var store : topology.servicesWithRole(ServiceRole.STORE)) {
            var named = store.getVolumes().stream().filter(VolumeMount::isNamed).toList();
            if (named.isEmpty()) {
                violations.add(TopologyViolation.error(ViolationType.STORE_NOT_PERSISTENT, store.getName(),
                        "store has no named volume; data is lost when the container is recreated"));
                continue;
            }

            var dataDir = store.env("PGDATA").orElse(DEFAULT_PGDATA);
            var covered = named.stream().anyMatch(mount -> isWithin(dataDir, mount.getTarget()));
            if (!covered) {
                violations.add(TopologyViolation.error(ViolationType.STORE_NOT_PERSISTENT, store.getName(),
                        "data directory " + dataDir + " is outside every named volume mount"));
            }
        }
    }

    private void checkBrokerHosts(DeploymentTopology topology, List<TopologyViolation> violations) {
        var brokers = topology.servicesWithRole(ServiceRole.BROKER).stream()
                .map(ServiceDescriptor::getName)
                .collect(Collectors.toSet());

        var hostsByRole = new HashMap<ServiceRole, String>();
        for (var service : topology.getServices().values()) {
            var role = service.role();
            if (role != ServiceRole.API && role != ServiceRole.WORKER && role != ServiceRole.SCHEDULER) {
                continue;
            }

            var url = brokerUrl(service);
            Optional<String> host;
            if (url.isPresent()) {
                host = hostOf(url.get());
                if (host.isEmpty()) {
                    violations.add(TopologyViolation.error(ViolationType.BROKER_HOST_MISMATCH, service.getName(),
                            "broker URL '" + url.get() + "' has no readable host"));
                    continue;
                }
            } else {
                host = brokerHostSetting(service);
            }
            if (host.isEmpty()) {
                if (role != ServiceRole.API) {
                    violations.add(TopologyViolation.warning(ViolationType.BROKER_HOST_MISMATCH, service.getName(),
                            "no broker URL configured; the built-in default applies"));
                }
                continue;
            }

            if (!brokers.contains(host.get())) {
                violations.add(TopologyViolation.error(ViolationType.BROKER_HOST_MISMATCH, service.getName(),
                        "broker host '" + host.get() + "' is not a declared broker service " + brokers));
            }
            if (role != ServiceRole.API) {
                hostsByRole.putIfAbsent(role, host.get());
            }
        }

        var workerHost = hostsByRole.get(ServiceRole.WORKER);
        var schedulerHost = hostsByRole.get(ServiceRole.SCHEDULER);
        if (workerHost != null && schedulerHost != null && !workerHost.equals(schedulerHost)) {
            violations.add(TopologyViolation.error(ViolationType.BROKER_HOST_MISMATCH, null,
                    "worker uses broker '" + workerHost + "' but scheduler uses '" + schedulerHost + "'"));
        }
    }

    private Optional<String> brokerUrl(ServiceDescriptor service) {
        for (var key : BROKER_URL_KEYS) {
            var url = service.env(key);
            if (url.isPresent()) {
                return url;
            }
        }
        return Optional.empty();
    }

    private Optional<String> brokerHostSetting(ServiceDescriptor service) {
        for (var key : BROKER_HOST_KEYS) {
            var host = service.env(key);
            if (host.isPresent()) {
                return host;
            }
        }
        return Optional.empty();
    }

    /**
     * Host part of a broker URL. Compose service names may contain '_', which
     * {@link URI#getHost()} rejects, so the authority is read directly in that case.
     */
    static Optional<String> hostOf(String url) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            log.debug("Broker URL {} is not a valid URI: {}", url, e.getMessage());
            return Optional.empty();
        }
        if (uri.getHost() != null) {
            return Optional.of(uri.getHost());
        }

        var authority = uri.getRawAuthority();
        if (authority == null) {
            return Optional.empty();
        }
        var host = authority.substring(authority.lastIndexOf('@') + 1);
        if (!host.startsWith("[")) {
            var colon = host.indexOf(':');
            if (colon >= 0) {
                host = host.substring(0, colon);
            }
        }
        return host.isBlank() ? Optional.empty() : Optional.of(host);
    }

    private void checkConnectionSettings(DeploymentTopology topology, List<TopologyViolation> violations) {
        var shapes = new LinkedHashMap<String, ConnectionShape>();
        var resolved = new LinkedHashMap<String, DatabaseDsn>();

        for (var service : topology.getServices().values()) {
            var shape = connectionShape(service);
            if (shape == null) {
                continue;
            }
            shapes.put(service.getName(), shape);
            if (shape == ConnectionShape.BOTH) {
                violations.add(TopologyViolation.warning(ViolationType.INCONSISTENT_CONNECTION_SHAPE, service.getName(),
                        "carries both " + ConnectionSettingsResolver.DSN + " and DB_* settings; keep only the DSN"));
            }

            try {
                new ConnectionSettingsResolver(environmentOf(service)).resolve()
                        .ifPresent(dsn -> resolved.put(service.getName(), dsn));
            } catch (InvalidConnectionSettingsException e) {
                violations.add(TopologyViolation.error(ViolationType.CONNECTION_PARAMETER_MISMATCH, service.getName(), e.getMessage()));
            }
        }

        var distinctShapes = shapes.values().stream()
                .filter(shape -> shape != ConnectionShape.BOTH)
                .distinct()
                .count();
        if (distinctShapes > 1) {
            violations.add(TopologyViolation.error(ViolationType.INCONSISTENT_CONNECTION_SHAPE, String.join(",", shapes.keySet()),
                    "services mix connection forms " + shapes + "; use " + ConnectionSettingsResolver.DSN + " everywhere"));
        }

        compareConsumers(resolved, violations);
        compareWithStore(topology, resolved, violations);
    }

    private ConnectionShape connectionShape(ServiceDescriptor service) {
        var hasDsn = service.env(ConnectionSettingsResolver.DSN).isPresent();
        var hasDiscrete = DISCRETE_KEYS.stream().anyMatch(key -> service.env(key).isPresent());
        if (hasDsn && hasDiscrete) {
            return ConnectionShape.BOTH;
        }
        if (hasDsn) {
            return ConnectionShape.DSN;
        }
        return hasDiscrete ? ConnectionShape.DISCRETE : null;
    }

    private void compareConsumers(Map<String, DatabaseDsn> resolved, List<TopologyViolation> violations) {
        if (resolved.size() < 2) {
            return;
        }
        var iterator = resolved.entrySet().iterator();
        var reference = iterator.next();
        while (iterator.hasNext()) {
            var other = iterator.next();
            var mismatches = ConnectionSettingsResolver.mismatches(reference.getValue(), other.getValue());
            if (!mismatches.isEmpty()) {
                violations.add(TopologyViolation.error(ViolationType.CONNECTION_PARAMETER_MISMATCH, other.getKey(),
                        "disagrees with " + reference.getKey() + " on " + mismatches));
            }
        }
    }

    private void compareWithStore(DeploymentTopology topology, Map<String, DatabaseDsn> resolved, List<TopologyViolation> violations) {
        var stores = topology.servicesWithRole(ServiceRole.STORE);
        if (stores.isEmpty()) {
            return;
        }

        resolved.forEach((consumer, dsn) -> {
            var store = topology.service(dsn.getHost()).filter(service -> service.role() == ServiceRole.STORE);
            if (store.isEmpty()) {
                violations.add(TopologyViolation.error(ViolationType.CONNECTION_PARAMETER_MISMATCH, consumer,
                        "database host '" + dsn.getHost() + "' is not a declared store service"));
                return;
            }

            var mismatches = new ArrayList<String>();
            var user = store.get().env("POSTGRES_USER").orElse("postgres");
            if (!Objects.equals(user, dsn.getUser())) mismatches.add("user");
            if (!Objects.equals(store.get().env("POSTGRES_DB").orElse(user), dsn.getDatabase())) mismatches.add("database");
            if (!Objects.equals(store.get().env("POSTGRES_PASSWORD").orElse(null), dsn.getPassword())) mismatches.add("password");
            if (dsn.getPort() != DatabaseDsn.DEFAULT_PORT) mismatches.add("port");

            if (!mismatches.isEmpty()) {
                violations.add(TopologyViolation.error(ViolationType.CONNECTION_PARAMETER_MISMATCH, consumer,
                        "disagrees with store " + store.get().getName() + " on " + mismatches));
            }
        });
    }

    private void checkApiStartupOrder(DeploymentTopology topology, List<TopologyViolation> violations) {
        var stores = topology.servicesWithRole(ServiceRole.STORE).stream()
                .map(ServiceDescriptor::getName)
                .collect(Collectors.toSet());
        if (stores.isEmpty()) {
            return;
        }
        for (var api : topology.servicesWithRole(ServiceRole.API)) {
            if (api.getDependsOn().stream().noneMatch(stores::contains)) {
                violations.add(TopologyViolation.error(ViolationType.MISSING_STORE_DEPENDENCY, api.getName(),
                        "API migrates the store on startup but does not depend on " + stores));
            }
        }
    }

    private void checkSchedulerSingleton(DeploymentTopology topology, List<TopologyViolation> violations) {
        var schedulers = topology.servicesWithRole(ServiceRole.SCHEDULER);
        var instances = schedulers.stream().mapToInt(ServiceDescriptor::getReplicas).sum();
        if (instances <= 1) {
            return;
        }

        var names = schedulers.stream().map(ServiceDescriptor::getName).collect(Collectors.joining(","));
        var lockable = schedulers.stream().allMatch(scheduler -> connectionShape(scheduler) != null);
        var message = instances + " scheduler instances declared";
        if (lockable) {
            violations.add(TopologyViolation.warning(ViolationType.SCHEDULER_NOT_SINGLETON, names,
                    message + "; only the holder of the store lock dispatches, the rest idle"));
        } else {
            violations.add(TopologyViolation.error(ViolationType.SCHEDULER_NOT_SINGLETON, names,
                    message + " without store settings for the scheduler lock; every task would be enqueued repeatedly"));
        }
    }

    /**
     * Whether {@code path} equals {@code mountTarget} or lies below it
     */
    static boolean isWithin(String path, String mountTarget) {
        if (mountTarget == null) {
            return false;
        }
        var normalizedPath = stripTrailingSlash(path);
        var normalizedTarget = stripTrailingSlash(mountTarget);
        return normalizedPath.equals(normalizedTarget) || normalizedPath.startsWith(normalizedTarget + "/");
    }

    private static String stripTrailingSlash(String path) {
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    private static PropertySourcesPropertyResolver environmentOf(ServiceDescriptor service) {
        var sources = new MutablePropertySources();
        sources.addFirst(new MapPropertySource(service.getName(), new HashMap<>(service.getEnvironment())));
        return new PropertySourcesPropertyResolver(sources);
    }
}
