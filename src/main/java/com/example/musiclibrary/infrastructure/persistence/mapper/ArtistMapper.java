package com.example.musiclibrary.infrastructure.persistence.mapper;

import com.example.musiclibrary.infrastructure.persistence.entity.ArtistEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.SelectKey;

@Mapper
public interface ArtistMapper {

    String COLUMNS = "id, name, created_at, updated_at";

    @Insert("INSERT INTO artists(name) VALUES (#{name})")
    @SelectKey(statement = "SELECT last_insert_rowid()", keyProperty = "id", before = false, resultType = Long.class)
    int insert(ArtistEntity entity);

    @Select("SELECT " + COLUMNS + " FROM artists WHERE id = #{id}")
    ArtistEntity selectById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM artists WHERE name = #{name} COLLATE NOCASE ORDER BY id LIMIT 1")
    ArtistEntity selectByName(@Param("name") String name);

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM artists "
            + "<where>"
            + "<if test='filter != null and filter != \"\"'>instr(name, #{filter}) &gt; 0</if>"
            + "</where>"
            + "ORDER BY name, id"
            + "</script>")
    List<ArtistEntity> selectAll(@Param("filter") String filter);

    @Delete("DELETE FROM artists WHERE NOT EXISTS (SELECT 1 FROM albums a WHERE a.artist_id = artists.id)")
    int deleteWithoutAlbums();

    @Select("SELECT COUNT(1) FROM artists")
    long countAll();
}
