package com.tongji.pipeline.relation.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MyBatisFollowerDirectory Unit Tests")
class MyBatisFollowerDirectoryTest {

    @Mock
    private RelationshipMapper relationshipMapper;

    @InjectMocks
    private MyBatisFollowerDirectory directory;

    @Test
    @DisplayName("should look followers up by the FOLLOW sort key and keep only user subjects")
    void shouldListFollowerIds() {
        when(relationshipMapper.listPkBySk("FOLLOW#u2")).thenReturn(List.of("USER#a", "USER#b", "POST#p1", "broken"));

        assertThat(directory.followerIds("u2")).containsExactly("a", "b");
    }

    @Test
    @DisplayName("should count followers by the FOLLOW sort key")
    void shouldCountFollowers() {
        when(relationshipMapper.countBySk("FOLLOW#u2")).thenReturn(7L);

        assertThat(directory.followerCount("u2")).isEqualTo(7L);
    }
}
