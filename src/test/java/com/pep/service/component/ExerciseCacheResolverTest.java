package com.pep.service.component;

import com.pep.mapper.ExerciseMapper;
import com.pep.mapper.PatientExerciseMapper;
import com.pep.model.dto.PatientProfile;
import com.pep.model.entity.Exercise;
import com.pep.model.entity.PatientExercise;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExerciseCacheResolverTest {

    private PatientExerciseMapper patientExerciseMapper;
    private ExerciseMapper exerciseMapper;
    private ExerciseCacheResolver resolver;

    @BeforeEach
    void setUp() {
        patientExerciseMapper = mock(PatientExerciseMapper.class);
        exerciseMapper = mock(ExerciseMapper.class);
        resolver = new ExerciseCacheResolver(patientExerciseMapper, exerciseMapper);
    }

    private static PatientProfile withoutPain(String patientId) {
        return PatientProfile.builder().patientId(patientId).build();
    }

    private static PatientProfile withPain(String patientId) {
        return PatientProfile.builder()
                .patientId(patientId)
                .painPoint(new PatientProfile.Pain("Pain climbing stairs", 6))
                .build();
    }

    private static PatientExercise link(String exerciseId) {
        PatientExercise link = new PatientExercise();
        link.setPatientId("P2");
        link.setExerciseId(exerciseId);
        return link;
    }

    private static Exercise exercise(String id) {
        Exercise exercise = new Exercise();
        exercise.setId(id);
        exercise.setName("Exercise " + id);
        return exercise;
    }

    @Test
    void threeDistinctLinkedExercisesIsHit() {
        when(patientExerciseMapper.selectByPatientId("P2")).thenReturn(List.of(link("e1"), link("e2"), link("e3")));
        when(exerciseMapper.selectByIds(List.of("e1", "e2", "e3")))
                .thenReturn(List.of(exercise("e3"), exercise("e1"), exercise("e2")));

        List<Exercise> resolved = resolver.resolve(withPain("P2"));

        assertThat(resolver.isHit(resolved)).isTrue();
        assertThat(resolved).extracting(Exercise::getId).containsExactly("e1", "e2", "e3");
        verify(exerciseMapper, never()).selectBySource(anyString(), anyInt());
    }

    @Test
    void repeatedAssignmentsCountOnce() {
        when(patientExerciseMapper.selectByPatientId("P2"))
                .thenReturn(List.of(link("e1"), link("e1"), link("e2"), link("e2")));
        when(exerciseMapper.selectByIds(List.of("e1", "e2"))).thenReturn(List.of(exercise("e1"), exercise("e2")));

        List<Exercise> resolved = resolver.resolve(withoutPain("P2"));

        assertThat(resolved).isEmpty();
        assertThat(resolver.isHit(resolved)).isFalse();
    }

    @Test
    void noPainPointsAndFewLinksReturnsEmpty() {
        when(patientExerciseMapper.selectByPatientId("P3")).thenReturn(List.of(link("e1")));
        when(exerciseMapper.selectByIds(List.of("e1"))).thenReturn(List.of(exercise("e1")));

        assertThat(resolver.resolve(withoutPain("P3"))).isEmpty();
        verify(exerciseMapper, never()).selectBySource(anyString(), anyInt());
    }

    @Test
    void painPointsFallBackToTemplates() {
        when(patientExerciseMapper.selectByPatientId("P4")).thenReturn(List.of());
        List<Exercise> templates = List.of(exercise("t1"), exercise("t2"), exercise("t3"), exercise("t4"));
        when(exerciseMapper.selectBySource("system-template", 5)).thenReturn(templates);

        List<Exercise> resolved = resolver.resolve(withPain("P4"));

        assertThat(resolved).containsExactlyElementsOf(templates);
        assertThat(resolver.isHit(resolved)).isTrue();
    }

    @Test
    void linksToMissingExercisesAreIgnored() {
        when(patientExerciseMapper.selectByPatientId("P5")).thenReturn(List.of(link("e1"), link("gone"), link("e2")));
        when(exerciseMapper.selectByIds(List.of("e1", "gone", "e2"))).thenReturn(List.of(exercise("e1"), exercise("e2")));

        assertThat(resolver.resolve(withoutPain("P5"))).isEmpty();
    }
}
