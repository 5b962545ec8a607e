package org.example.biolearn.repository;

import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class MongoDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoDocumentStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public String insert(String collection, Map<String, Object> document) {
        Document toSave = new Document(document);
        toSave.putIfAbsent(ID_FIELD, new ObjectId());
        try {
            Document saved = mongoTemplate.insert(toSave, collection);
            return String.valueOf(saved.get(ID_FIELD));
        } catch (DuplicateKeyException e) {
            throw new DuplicateDocumentException(collection, e);
        } catch (DataAccessException e) {
            throw unavailable("insert into " + collection, e);
        }
    }

    @Override
    public List<Map<String, Object>> findAll(String collection) {
        try {
            return new ArrayList<>(mongoTemplate.findAll(Document.class, collection));
        } catch (DataAccessException e) {
            throw unavailable("read " + collection, e);
        }
    }

    @Override
    public Optional<Map<String, Object>> findOne(String collection, Map<String, Object> filter) {
        try {
            Document found = mongoTemplate.findOne(toQuery(filter), Document.class, collection);
            return Optional.<Map<String, Object>>ofNullable(found);
        } catch (DataAccessException e) {
            throw unavailable("read " + collection, e);
        }
    }

    @Override
    public List<Map<String, Object>> findMany(String collection, Map<String, Object> filter, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        Query query = toQuery(filter).limit(limit);
        try {
            return new ArrayList<>(mongoTemplate.find(query, Document.class, collection));
        } catch (DataAccessException e) {
            throw unavailable("read " + collection, e);
        }
    }

    @Override
    public List<String> collectionNames() {
        try {
            return mongoTemplate.getCollectionNames().stream().sorted().toList();
        } catch (DataAccessException e) {
            throw unavailable("list collections", e);
        }
    }

    @Override
    public String databaseName() {
        return mongoTemplate.getDb().getName();
    }

    @Override
    public void ensureUniqueIndex(String collection, String field) {
        try {
            String name = mongoTemplate.indexOps(collection)
                    .ensureIndex(new Index().on(field, Sort.Direction.ASC).unique());
            log.info("Unique index {} ensured on {}.{}", name, collection, field);
        } catch (DataAccessException e) {
            throw unavailable("create index on " + collection + "." + field, e);
        }
    }

    private Query toQuery(Map<String, Object> filter) {
        Query query = new Query();
        if (filter != null) {
            filter.forEach((field, value) -> query.addCriteria(Criteria.where(field).is(value)));
        }
        return query;
    }

    private StoreUnavailableException unavailable(String operation, DataAccessException cause) {
        String reason = cause.getMostSpecificCause().getMessage();
        return new StoreUnavailableException("Failed to " + operation + ": " + reason, cause);
    }
}
