package com.pep.mapper;

import com.pep.model.entity.Exercise;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface ExerciseMapper {

    Exercise getById(String id);

    /**
     * 按名称精确匹配（区分大小写）
     * @param name 动作名称
     * @return 已存在的动作，没有则返回 null
     */
    Exercise getByName(String name);

    /**
     * 批量按ID查询
     */
    List<Exercise> selectByIds(@Param("ids") List<String> ids);

    /**
     * 查询指定来源的动作
     * @param source 来源标记
     * @param limit 最大条数
     */
    List<Exercise> selectBySource(@Param("source") String source, @Param("limit") int limit);

    /**
     * 新增动作，name 冲突时抛出 DuplicateKeyException
     */
    int insert(Exercise exercise);

    /**
     * 回填视频字段：每一列只在当前为空时才写入，已有值保持不变
     * @param id 动作ID
     * @param videoUrl 待回填的视频地址，为 null 时不处理
     * @param videoThumbnail 待回填的缩略图，为 null 时不处理
     */
    int fillMediaIfEmpty(@Param("id") String id,
                         @Param("videoUrl") String videoUrl,
                         @Param("videoThumbnail") String videoThumbnail);
}
