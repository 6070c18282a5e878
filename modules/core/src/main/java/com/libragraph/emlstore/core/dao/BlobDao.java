package com.libragraph.emlstore.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(BlobRecord.class)
public interface BlobDao {

    @SqlQuery("SELECT * FROM cas_blob WHERE hash = :hash")
    Optional<BlobRecord> findByHash(@Bind("hash") String hash);

    @SqlUpdate("INSERT INTO cas_blob (hash, size_bytes, ref_count) VALUES (:hash, :sizeBytes, 1)")
    void insert(@Bind("hash") String hash, @Bind("sizeBytes") long sizeBytes);

    @SqlUpdate("UPDATE cas_blob SET ref_count = ref_count + 1 WHERE hash = :hash")
    int incrementRefCount(@Bind("hash") String hash);

    @SqlUpdate("UPDATE cas_blob SET ref_count = ref_count - 1 WHERE hash = :hash AND ref_count > 1")
    int decrementRefCount(@Bind("hash") String hash);

    @SqlUpdate("DELETE FROM cas_blob WHERE hash = :hash")
    int deleteByHash(@Bind("hash") String hash);

    @SqlUpdate("DELETE FROM cas_blob")
    int deleteAll();

    @SqlQuery("SELECT * FROM cas_blob ORDER BY hash")
    List<BlobRecord> findAll();

    @SqlQuery("SELECT COUNT(*) FROM cas_blob")
    int count();

    @SqlQuery("SELECT COALESCE(SUM(size_bytes), 0) FROM cas_blob")
    long totalSizeBytes();
}
