package io.github.manjago.memguard.monitor;

import io.github.manjago.memguard.config.MonitorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Default sensor: host memory, narrowed to the cgroup limit when the
 * process runs in a container whose limit is below the host total.
 *
 * A broken cgroup read falls back to the host view; a broken host read fails.
 */
public class SystemMemorySampler implements MemorySampler {

    private static final Logger log = LoggerFactory.getLogger(SystemMemorySampler.class);

    private final ProcMeminfoSampler host;
    private final CgroupMemorySampler cgroup;

    public SystemMemorySampler(ProcMeminfoSampler host, CgroupMemorySampler cgroup) {
        this.host = host;
        this.cgroup = cgroup;
    }

    public static SystemMemorySampler fromConfig(MonitorConfig config, Clock clock) {
        return new SystemMemorySampler(
                new ProcMeminfoSampler(config.meminfoPath(), clock),
                new CgroupMemorySampler(config.cgroupRoot(), clock));
    }

    @Override
    public MemorySnapshot sample() throws MemorySamplingException {
        MemorySnapshot hostSnapshot = host.sample();

        Optional<MemorySnapshot> container;
        try {
            container = cgroup.sampleIfLimited();
        } catch (MemorySamplingException e) {
            log.debug("Cgroup memory unreadable, using host memory: {}", e.getMessage());
            return hostSnapshot;
        }

        if (container.isPresent() && container.get().totalBytes() < hostSnapshot.totalBytes()) {
            return container.get();
        }
        return hostSnapshot;
    }

    @Override
    public String toString() {
        return "SystemMemorySampler[" + host + ", " + cgroup + "]";
    }
}
