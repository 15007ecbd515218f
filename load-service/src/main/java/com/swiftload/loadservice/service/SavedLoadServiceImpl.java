package com.swiftload.loadservice.service;

import com.swiftload.loadservice.dto.LoadResponse;
import com.swiftload.loadservice.dto.SavedLoadToggleResponse;
import com.swiftload.loadservice.mapper.LoadMapper;
import com.swiftload.loadservice.model.SavedLoad;
import com.swiftload.loadservice.repository.LoadRepository;
import com.swiftload.loadservice.repository.SavedLoadRepository;
import com.swiftload.loadservice.security.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class SavedLoadServiceImpl implements SavedLoadService {

    private final SavedLoadRepository savedLoadRepository;
    private final LoadRepository loadRepository;
    private final LoadService loadService;
    private final LoadMapper loadMapper;

    @Override
    @Transactional
    public SavedLoadToggleResponse toggle(UUID loadId, Actor actor) {
        loadService.findLoad(loadId);

        Optional<SavedLoad> existing = savedLoadRepository.findByUserIdAndLoadId(actor.getUserId(), loadId);
        if (existing.isPresent()) {
            savedLoadRepository.delete(existing.get());
            log.info("Saved load removed: userId={}, loadId={}", actor.getUserId(), loadId);
            return new SavedLoadToggleResponse(loadId, false);
        }

        savedLoadRepository.save(SavedLoad.builder()
                .userId(actor.getUserId())
                .loadId(loadId)
                .build());
        log.info("Load saved: userId={}, loadId={}", actor.getUserId(), loadId);
        return new SavedLoadToggleResponse(loadId, true);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LoadResponse> listSaved(Actor actor) {
        List<UUID> loadIds = savedLoadRepository.findByUserIdOrderByCreatedAtDesc(actor.getUserId()).stream()
                .map(SavedLoad::getLoadId)
                .collect(Collectors.toList());

        // findAllById does not keep order
        return loadRepository.findAllById(loadIds).stream()
                .sorted((a, b) -> Integer.compare(loadIds.indexOf(a.getId()), loadIds.indexOf(b.getId())))
                .map(loadMapper::toLoadResponse)
                .collect(Collectors.toList());
    }
}
