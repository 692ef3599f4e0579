package com.xksgroup.downloadtracker.repo;

import com.mongodb.client.result.UpdateResult;
import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.MediaMatch;
import com.xksgroup.downloadtracker.model.download.Priority;
import com.xksgroup.downloadtracker.model.download.SyncFields;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

@RequiredArgsConstructor
public class DownloadRecordRepositoryImpl implements DownloadRecordRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public void applySyncFields(String id, SyncFields fields) {
        Update update = new Update()
                .set("name", fields.getName())
                .set("status", fields.getStatus())
                .set("detailedStatus", fields.getDetailedStatus())
                .set("progress", fields.getProgress())
                .set("speed", fields.getSpeed())
                .set("sizeTotal", fields.getSizeTotal())
                .set("sizeLeft", fields.getSizeLeft())
                .set("timeLeft", fields.getTimeLeft())
                .set("queuePosition", fields.getQueuePosition())
                .set("category", fields.getCategory())
                .set("priority", fields.getPriority())
                .set("failureReason", fields.getFailureReason())
                .set("completedAt", fields.getCompletedAt())
                .set("consecutiveMisses", fields.getConsecutiveMisses());

        mongoTemplate.updateFirst(byId(id), update, DownloadRecord.class);
    }

    @Override
    public void setPriority(String id, Priority priority) {
        mongoTemplate.updateFirst(byId(id), Update.update("priority", priority), DownloadRecord.class);
    }

    @Override
    public boolean claimForEnrichment(String id) {
        Query query = new Query(Criteria.where("_id").is(id).and("posterAttempted").ne(true));
        UpdateResult result = mongoTemplate.updateFirst(query, Update.update("posterAttempted", true), DownloadRecord.class);
        return result.getModifiedCount() > 0;
    }

    @Override
    public void saveMediaMatch(String id, MediaMatch match) {
        mongoTemplate.updateFirst(byId(id), Update.update("mediaMatch", match), DownloadRecord.class);
    }

    @Override
    public long resetPosterAttempted() {
        Query query = new Query(Criteria.where("posterAttempted").is(true));
        UpdateResult result = mongoTemplate.updateMulti(query, Update.update("posterAttempted", false), DownloadRecord.class);
        return result.getModifiedCount();
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }
}
