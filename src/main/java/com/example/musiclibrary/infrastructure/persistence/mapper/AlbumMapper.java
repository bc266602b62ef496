package com.example.musiclibrary.infrastructure.persistence.mapper;

import com.example.musiclibrary.infrastructure.persistence.entity.AlbumEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.SelectKey;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface AlbumMapper {

    String COLUMNS = "id, artist_id, title, year, genre, compilation, path, dr_value, artwork_path, "
            + "format, bits_per_sample, sample_rate, created_at, updated_at";

    @Insert("INSERT INTO albums("
            + "artist_id, title, year, genre, compilation, path, artwork_path, format, bits_per_sample, sample_rate"
            + ") VALUES ("
            + "#{artistId}, #{title}, #{year}, #{genre}, #{compilation}, #{path}, #{artworkPath}, "
            + "#{format}, #{bitsPerSample}, #{sampleRate})")
    @SelectKey(statement = "SELECT last_insert_rowid()", keyProperty = "id", before = false, resultType = Long.class)
    int insert(AlbumEntity entity);

    /**
     * Rewrites every derived column. dr_value is owned by the DR coordinator and left alone.
     */
    @Update("UPDATE albums SET "
            + "artist_id = #{artistId}, "
            + "title = #{title}, "
            + "year = #{year}, "
            + "genre = #{genre}, "
            + "compilation = #{compilation}, "
            + "path = #{path}, "
            + "artwork_path = #{artworkPath}, "
            + "format = #{format}, "
            + "bits_per_sample = #{bitsPerSample}, "
            + "sample_rate = #{sampleRate}, "
            + "updated_at = CURRENT_TIMESTAMP "
            + "WHERE id = #{id}")
    int update(AlbumEntity entity);

    @Select("SELECT " + COLUMNS + " FROM albums WHERE id = #{id}")
    AlbumEntity selectById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM albums WHERE path = #{path}")
    AlbumEntity selectByPath(@Param("path") String path);

    @Select("SELECT " + COLUMNS + " FROM albums "
            + "WHERE artist_id = #{artistId} AND title = #{title} COLLATE NOCASE AND year IS #{year} "
            + "ORDER BY id LIMIT 1")
    AlbumEntity selectByNaturalKey(@Param("artistId") Long artistId,
                                   @Param("title") String title,
                                   @Param("year") Integer year);

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM albums "
            + "<where>"
            + "<if test='filter != null and filter != \"\"'>instr(title, #{filter}) &gt; 0</if>"
            + "</where>"
            + "ORDER BY title, year, id"
            + "</script>")
    List<AlbumEntity> selectAll(@Param("filter") String filter);

    @Select("SELECT " + COLUMNS + " FROM albums WHERE artist_id = #{artistId} ORDER BY title, year, id")
    List<AlbumEntity> selectByArtistId(@Param("artistId") Long artistId);

    @Select("SELECT dr_value FROM albums WHERE path = #{path}")
    String selectDrValueByPath(@Param("path") String path);

    @Update("UPDATE albums SET dr_value = #{drValue}, updated_at = CURRENT_TIMESTAMP WHERE path = #{path}")
    int updateDrValueByPath(@Param("path") String path, @Param("drValue") String drValue);

    @Delete("DELETE FROM albums WHERE NOT EXISTS (SELECT 1 FROM tracks t WHERE t.album_id = albums.id)")
    int deleteWithoutTracks();

    @Select("SELECT COUNT(1) FROM albums")
    long countAll();
}
