package com.micemail.mapper;

import com.micemail.domain.SeenRecipient;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface SeenRecipientMapper {

    @Select("SELECT COUNT(*) FROM seen_recipient WHERE email = #{email}")
    int countByEmail(@Param("email") String email);

    /**
     * @return 1 if a row was inserted, 0 if the address was already present
     */
    @Insert("INSERT OR IGNORE INTO seen_recipient (email, created_dt) VALUES (#{email}, datetime('now'))")
    int insertIfAbsent(@Param("email") String email);

    @Select("SELECT id, email, created_dt AS createdDt FROM seen_recipient ORDER BY id")
    List<SeenRecipient> findAll();
}
