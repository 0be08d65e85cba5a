package com.example.medialibrary.service;

import com.example.medialibrary.entity.MediaRecordEntity;
import com.example.medialibrary.exception.DuplicateMediaException;
import com.example.medialibrary.exception.LibraryStoreException;
import com.example.medialibrary.exception.MediaRecordNotFoundException;
import com.example.medialibrary.model.LibraryStats;
import com.example.medialibrary.model.MediaRecord;
import com.example.medialibrary.repository.MediaRecordRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Authoritative store of library records. Every write runs in one transaction together with the
 * trigger-maintained full-text index, so a row and its index entry are committed or rolled back as a unit.
 */
@Service
@Slf4j
public class LibraryStoreService {

    private final MediaRecordRepository repository;
    private final TransactionTemplate transactionTemplate;

    public LibraryStoreService(MediaRecordRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @PostConstruct
    public void init() {
        log.info("Библиотека открыта, записей: {}", count());
    }

    /**
     * Inserts a new record. Duplicate checks, the row and its index entry share one transaction.
     *
     * @throws DuplicateMediaException when the URL, the platform/source id pair or the content hash is
     *                                 already stored
     */
    public MediaRecord insert(MediaRecord record) {
        validateRating(record.getRating());
        try {
            MediaRecord saved = transactionTemplate.execute(status -> {
                checkDuplicates(record);
                MediaRecordEntity entity = mapToEntity(record);
                if (entity.getIngestedAt() == null) {
                    entity.setIngestedAt(LocalDateTime.now());
                }
                return mapToDomain(repository.saveAndFlush(entity));
            });
            log.debug("Сохранена запись: id={}, platform={}, sourceId={}",
                    saved.getId(), saved.getPlatform(), saved.getSourceId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw classifyConflict(record, e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Ошибка сохранения записи {}: {}", record.getSourceUrl(), e.getMessage(), e);
            throw new LibraryStoreException("Не удалось сохранить запись " + record.getSourceUrl(), e);
        }
    }

    /**
     * Updates the user-owned fields and the storage paths of an existing record.
     */
    public MediaRecord update(MediaRecord record) {
        if (record.getId() == null) {
            throw new IllegalArgumentException("Для обновления нужен id записи");
        }
        validateRating(record.getRating());
        return inTransaction(() -> {
            MediaRecordEntity entity = repository.findById(record.getId())
                    .orElseThrow(() -> new MediaRecordNotFoundException(record.getId()));
            entity.setTags(new ArrayList<>(record.getTags() != null ? record.getTags() : List.of()));
            entity.setRating(record.getRating());
            entity.setNotes(record.getNotes());
            entity.setCollection(record.getCollection());
            entity.setLocalPath(record.getLocalPath());
            entity.setThumbnailPath(record.getThumbnailPath());
            MediaRecord updated = mapToDomain(repository.saveAndFlush(entity));
            log.debug("Обновлена запись: id={}", updated.getId());
            return updated;
        });
    }

    public boolean delete(long id) {
        boolean deleted = inTransaction(() -> repository.deleteRecordById(id) > 0);
        if (deleted) {
            log.info("Удалена запись: id={}", id);
        }
        return deleted;
    }

    public boolean existsByUrl(String url) {
        return inTransaction(() -> repository.existsBySourceUrl(url));
    }

    public boolean existsByHash(String contentHash) {
        return inTransaction(() -> repository.existsByContentHash(contentHash));
    }

    public Optional<MediaRecord> findByUrl(String url) {
        return inTransaction(() -> repository.findBySourceUrl(url).map(this::mapToDomain));
    }

    public Optional<MediaRecord> findByContentHash(String contentHash) {
        return inTransaction(() -> repository.findFirstByContentHash(contentHash).map(this::mapToDomain));
    }

    public Optional<MediaRecord> find(long id) {
        return inTransaction(() -> repository.findById(id).map(this::mapToDomain));
    }

    public MediaRecord get(long id) {
        return find(id).orElseThrow(() -> new MediaRecordNotFoundException(id));
    }

    /**
     * Phrase-prefix search over title, description, uploader, tags and notes. Best match first; equal
     * ranks are ordered newest first.
     */
    public List<MediaRecord> search(String query, int limit) {
        requirePositive(limit);
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String matchExpression = toMatchExpression(query);
        return inTransaction(() -> mapAll(repository.search(matchExpression, limit)));
    }

    static String toMatchExpression(String query) {
        return "\"" + query.trim().replace("\"", "\"\"") + "\"*";
    }

    public List<MediaRecord> findRecent(int limit) {
        requirePositive(limit);
        return inTransaction(() -> mapAll(repository.findAllByOrderByIngestedAtDescIdDesc(PageRequest.of(0, limit))));
    }

    public List<MediaRecord> findByPlatform(String platform, int limit) {
        requirePositive(limit);
        return inTransaction(() -> mapAll(
                repository.findByPlatformOrderByIngestedAtDescIdDesc(platform, PageRequest.of(0, limit))));
    }

    public List<MediaRecord> findByCollection(String collection, int limit) {
        requirePositive(limit);
        return inTransaction(() -> mapAll(
                repository.findByCollectionOrderByIngestedAtDescIdDesc(collection, PageRequest.of(0, limit))));
    }

    public List<MediaRecord> findByUploader(String uploader, int limit) {
        requirePositive(limit);
        return inTransaction(() -> mapAll(repository.findByUploaderOrUploaderId(uploader, PageRequest.of(0, limit))));
    }

    public Map<String, Long> uploaderCounts() {
        return inTransaction(() -> toCountMap(repository.countByUploader()));
    }

    public LibraryStats stats() {
        return inTransaction(() -> LibraryStats.builder()
                .count(repository.count())
                .totalBytes(repository.sumFileSizeBytes())
                .perPlatformCounts(toCountMap(repository.countByPlatform()))
                .build());
    }

    public long count() {
        return inTransaction(repository::count);
    }

    private void checkDuplicates(MediaRecord record) {
        repository.findBySourceUrl(record.getSourceUrl()).ifPresent(existing -> {
            throw DuplicateMediaException.byUrl(record.getSourceUrl(), existing.getId());
        });
        repository.findByPlatformAndSourceId(record.getPlatform(), record.getSourceId()).ifPresent(existing -> {
            throw DuplicateMediaException.bySourceId(record.getPlatform(), record.getSourceId(), existing.getId());
        });
        if (record.getContentHash() != null) {
            repository.findFirstByContentHash(record.getContentHash()).ifPresent(existing -> {
                throw DuplicateMediaException.byContentHash(record.getContentHash(), existing.getId());
            });
        }
    }

    // A unique violation that slipped past checkDuplicates: name the conflicting row if it is visible now
    private RuntimeException classifyConflict(MediaRecord record, DataIntegrityViolationException cause) {
        log.warn("Нарушение ограничения при сохранении {}: {}", record.getSourceUrl(), cause.getMessage());
        try {
            inTransaction(() -> {
                checkDuplicates(record);
                return null;
            });
        } catch (DuplicateMediaException duplicate) {
            return duplicate;
        }
        return new LibraryStoreException("Нарушено ограничение целостности для " + record.getSourceUrl(), cause);
    }

    private <T> T inTransaction(Supplier<T> action) {
        try {
            return transactionTemplate.execute(status -> action.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("Ошибка хранилища: {}", e.getMessage(), e);
            throw new LibraryStoreException("Ошибка хранилища: " + e.getMessage(), e);
        }
    }

    private static void validateRating(Integer rating) {
        if (rating != null && (rating < 1 || rating > 5)) {
            throw new IllegalArgumentException("Рейтинг должен быть от 1 до 5: " + rating);
        }
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit должен быть положительным: " + limit);
        }
    }

    private static Map<String, Long> toCountMap(List<MediaRecordRepository.NamedCount> counts) {
        Map<String, Long> result = new LinkedHashMap<>();
        for (MediaRecordRepository.NamedCount count : counts) {
            result.put(count.getName(), count.getTotal());
        }
        return result;
    }

    private List<MediaRecord> mapAll(List<MediaRecordEntity> entities) {
        return entities.stream()
                .map(this::mapToDomain)
                .collect(Collectors.toList());
    }

    private MediaRecordEntity mapToEntity(MediaRecord record) {
        return MediaRecordEntity.builder()
                .id(record.getId())
                .sourceUrl(record.getSourceUrl())
                .platform(record.getPlatform())
                .sourceId(record.getSourceId())
                .title(record.getTitle())
                .description(record.getDescription())
                .uploader(record.getUploader())
                .uploaderId(record.getUploaderId())
                .uploadDate(record.getUploadDate())
                .durationSeconds(record.getDurationSeconds())
                .viewCount(record.getViewCount())
                .likeCount(record.getLikeCount())
                .commentCount(record.getCommentCount())
                .resolution(record.getResolution())
                .fps(record.getFps())
                .codec(record.getCodec())
                .fileSizeBytes(record.getFileSizeBytes())
                .contentHash(record.getContentHash())
                .localPath(record.getLocalPath())
                .thumbnailPath(record.getThumbnailPath())
                .ingestedAt(record.getIngestedAt())
                .tags(new ArrayList<>(record.getTags() != null ? record.getTags() : List.of()))
                .rating(record.getRating())
                .notes(record.getNotes())
                .collection(record.getCollection())
                .rawMetadata(record.getRawMetadata())
                .build();
    }

    private MediaRecord mapToDomain(MediaRecordEntity entity) {
        return MediaRecord.builder()
                .id(entity.getId())
                .sourceUrl(entity.getSourceUrl())
                .platform(entity.getPlatform())
                .sourceId(entity.getSourceId())
                .title(entity.getTitle())
                .description(entity.getDescription())
                .uploader(entity.getUploader())
                .uploaderId(entity.getUploaderId())
                .uploadDate(entity.getUploadDate())
                .durationSeconds(entity.getDurationSeconds())
                .viewCount(entity.getViewCount())
                .likeCount(entity.getLikeCount())
                .commentCount(entity.getCommentCount())
                .resolution(entity.getResolution())
                .fps(entity.getFps())
                .codec(entity.getCodec())
                .fileSizeBytes(entity.getFileSizeBytes())
                .contentHash(entity.getContentHash())
                .localPath(entity.getLocalPath())
                .thumbnailPath(entity.getThumbnailPath())
                .ingestedAt(entity.getIngestedAt())
                .tags(new ArrayList<>(entity.getTags()))
                .rating(entity.getRating())
                .notes(entity.getNotes())
                .collection(entity.getCollection())
                .rawMetadata(entity.getRawMetadata())
                .build();
    }
}
