package com.starscape.mediaindex.features.batch.app;

import com.starscape.mediaindex.common.events.ChangeNotifier;
import com.starscape.mediaindex.common.events.EntityKind;
import com.starscape.mediaindex.common.exception.NotFoundException;
import com.starscape.mediaindex.common.security.AccessControl;
import com.starscape.mediaindex.common.security.Action;
import com.starscape.mediaindex.common.security.Resource;
import com.starscape.mediaindex.common.security.UserPrincipal;
import com.starscape.mediaindex.features.batch.domain.BatchResult;
import com.starscape.mediaindex.features.batch.domain.Selection;
import com.starscape.mediaindex.features.library.app.PhotoCountsUpdater;
import com.starscape.mediaindex.features.library.domain.Label;
import com.starscape.mediaindex.features.library.domain.LabelRepository;
import com.starscape.mediaindex.features.library.domain.PhotoLabelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Handler for deleting labels. A label is soft-deleted after its photo links
 * are removed; a failed label is logged and skipped.
 */
@Service
public class DeleteLabelsHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeleteLabelsHandler.class);
    
    private final AccessControl accessControl;
    private final LabelRepository labelRepository;
    private final PhotoLabelRepository photoLabelRepository;
    private final PhotoCountsUpdater countsUpdater;
    private final ChangeNotifier notifier;
    
    public DeleteLabelsHandler(
            AccessControl accessControl,
            LabelRepository labelRepository,
            PhotoLabelRepository photoLabelRepository,
            PhotoCountsUpdater countsUpdater,
            ChangeNotifier notifier) {
        this.accessControl = accessControl;
        this.labelRepository = labelRepository;
        this.photoLabelRepository = photoLabelRepository;
        this.countsUpdater = countsUpdater;
        this.notifier = notifier;
    }
    
    public BatchResult handle(UserPrincipal caller, Selection selection) {
        accessControl.check(caller, Resource.LABELS, Action.DELETE);
        List<String> uids = selection.requireLabels();
        
        log.info("Deleting {} labels for {}", uids.size(), caller);
        
        List<Label> labels = labelRepository.findActiveByUids(uids);
        if (labels.isEmpty()) {
            throw new NotFoundException("No labels found for selection");
        }
        
        List<String> deleted = new ArrayList<>();
        for (Label label : labels) {
            try {
                photoLabelRepository.deleteByLabelUid(label.getLabelUid());
                label.markDeleted(Instant.now());
                labelRepository.save(label);
                deleted.add(label.getLabelUid());
            } catch (DataAccessException | TransactionException e) {
                log.error("Failed to delete label {}: {}", label.getLabelUid(), e.getMessage());
            }
        }
        
        if (!deleted.isEmpty()) {
            countsUpdater.refresh();
            notifier.entitiesDeleted(EntityKind.LABELS, deleted);
        }
        
        log.info("Deleted {} of {} selected labels", deleted.size(), uids.size());
        return new BatchResult("Labels deleted", deleted.size());
    }
}
