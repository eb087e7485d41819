package com.agenttracker.discovery.service.merge;

import com.agenttracker.discovery.entity.discovery.Discovery;
import com.agenttracker.discovery.repository.DiscoveryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaDiscoveryStore implements DiscoveryStore {

    private final DiscoveryRepository discoveryRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Discovery> findByKey(Long projectId, String source) {
        return discoveryRepository.findByProjectIdAndSource(projectId, source);
    }

    @Override
    @Transactional
    public Discovery insert(Discovery discovery) {
        // flush so a unique-key clash surfaces here, not at commit
        return discoveryRepository.saveAndFlush(discovery);
    }

    @Override
    @Transactional
    public Discovery update(Discovery discovery) {
        return discoveryRepository.saveAndFlush(discovery);
    }

    @Override
    @Transactional(readOnly = true)
    public long countDiscoveredSince(Long projectId, LocalDateTime since) {
        return discoveryRepository.countByProjectIdAndDiscoveredAtAfter(projectId, since);
    }
}
