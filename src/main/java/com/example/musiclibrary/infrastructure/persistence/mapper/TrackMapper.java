package com.example.musiclibrary.infrastructure.persistence.mapper;

import com.example.musiclibrary.infrastructure.persistence.entity.TrackEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface TrackMapper {

    String COLUMNS = "id, album_id, title, track_number, disc_number, duration_ms, path, file_size, format, codec, "
            + "sample_rate, bits_per_sample, channels, is_lossless, is_high_resolution, created_at, updated_at";

    @Insert("INSERT INTO tracks("
            + "album_id, title, track_number, disc_number, duration_ms, path, file_size, format, codec, "
            + "sample_rate, bits_per_sample, channels, is_lossless, is_high_resolution"
            + ") VALUES ("
            + "#{albumId}, #{title}, #{trackNumber}, #{discNumber}, #{durationMs}, #{path}, #{fileSize}, #{format}, #{codec}, "
            + "#{sampleRate}, #{bitsPerSample}, #{channels}, #{isLossless}, #{isHighResolution}"
            + ") ON CONFLICT(path) DO UPDATE SET "
            + "album_id = excluded.album_id, "
            + "title = excluded.title, "
            + "track_number = excluded.track_number, "
            + "disc_number = excluded.disc_number, "
            + "duration_ms = excluded.duration_ms, "
            + "file_size = excluded.file_size, "
            + "format = excluded.format, "
            + "codec = excluded.codec, "
            + "sample_rate = excluded.sample_rate, "
            + "bits_per_sample = excluded.bits_per_sample, "
            + "channels = excluded.channels, "
            + "is_lossless = excluded.is_lossless, "
            + "is_high_resolution = excluded.is_high_resolution, "
            + "updated_at = CURRENT_TIMESTAMP")
    int upsert(TrackEntity entity);

    @Select("SELECT " + COLUMNS + " FROM tracks WHERE path = #{path}")
    TrackEntity selectByPath(@Param("path") String path);

    @Select("SELECT " + COLUMNS + " FROM tracks WHERE album_id = #{albumId} "
            + "ORDER BY disc_number, track_number NULLS LAST, title")
    List<TrackEntity> selectByAlbumId(@Param("albumId") Long albumId);

    @Select("SELECT t.id, t.album_id, t.title, t.track_number, t.disc_number, t.duration_ms, t.path, t.file_size, "
            + "t.format, t.codec, t.sample_rate, t.bits_per_sample, t.channels, t.is_lossless, t.is_high_resolution, "
            + "t.created_at, t.updated_at "
            + "FROM tracks t JOIN albums a ON a.id = t.album_id "
            + "WHERE a.artist_id = #{artistId} "
            + "ORDER BY a.title, t.disc_number, t.track_number NULLS LAST, t.title")
    List<TrackEntity> selectByArtistId(@Param("artistId") Long artistId);

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM tracks "
            + "<where>"
            + "<if test='filter != null and filter != \"\"'>instr(title, #{filter}) &gt; 0</if>"
            + "</where>"
            + "ORDER BY title, path"
            + "</script>")
    List<TrackEntity> selectByTitle(@Param("filter") String filter);

    @Select("SELECT path FROM tracks WHERE substr(path, 1, length(#{prefix})) = #{prefix} ORDER BY path")
    List<String> selectPathsUnderPrefix(@Param("prefix") String prefix);

    @Select("SELECT COUNT(1) FROM tracks "
            + "WHERE album_id = #{albumId} AND substr(path, 1, length(#{prefix})) != #{prefix}")
    long countByAlbumOutsidePrefix(@Param("albumId") Long albumId, @Param("prefix") String prefix);

    @Delete("DELETE FROM tracks WHERE path = #{path}")
    int deleteByPath(@Param("path") String path);

    @Delete("DELETE FROM tracks WHERE substr(path, 1, length(#{prefix})) = #{prefix}")
    int deleteUnderPrefix(@Param("prefix") String prefix);

    @Select("SELECT COUNT(1) FROM tracks")
    long countAll();
}
