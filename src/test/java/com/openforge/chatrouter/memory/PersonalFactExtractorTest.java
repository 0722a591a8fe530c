package com.openforge.chatrouter.memory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PersonalFactExtractorTest {

    private final PersonalFactExtractor extractor = new PersonalFactExtractor();

    @Nested
    @DisplayName("extract")
    class Extract {

        @Test
        @DisplayName("should find several facts in one introduction")
        void introduction() {
            List<PersonalFactExtractor.Fact> facts = extractor.extract(
                    "Hi! My name is kunal, I am 17 years old and I live in New Delhi.");

            assertThat(facts).extracting(PersonalFactExtractor.Fact::tag)
                    .containsExactly("name", "age", "location");
            assertThat(facts.get(0).value()).isEqualTo("Kunal");
            assertThat(facts.get(0).statement()).isEqualTo("User's name is Kunal");
            assertThat(facts.get(0).importance()).isEqualTo(5);
            assertThat(facts.get(1).statement()).isEqualTo("User is 17 years old");
            assertThat(facts.get(2).value()).isEqualTo("New Delhi");
        }

        @Test
        @DisplayName("should read subject and goal statements")
        void studies() {
            List<PersonalFactExtractor.Fact> facts = extractor.extract(
                    "I'm studying organic chemistry. My goal is to clear the entrance exam");

            assertThat(facts).extracting(PersonalFactExtractor.Fact::statement).containsExactly(
                    "User is studying organic chemistry",
                    "User's goal is to clear the entrance exam");
        }

        @Test
        @DisplayName("should ignore implausible ages")
        void implausibleAge() {
            assertThat(extractor.extract("I am 300 years old")).isEmpty();
        }

        @Test
        @DisplayName("should not read counts of other things as an age")
        void numbersThatAreNotAges() {
            assertThat(extractor.extract("Sorry, I am 20 minutes late for the session")).isEmpty();
            assertThat(extractor.extract("I'm 3 chapters behind in calculus")).isEmpty();
        }

        @Test
        @DisplayName("should read an age from 'age is' and 'aged' without a unit")
        void agePhrasings() {
            assertThat(extractor.extract("My age is 19")).extracting(PersonalFactExtractor.Fact::value)
                    .containsExactly("19");
            assertThat(extractor.extract("I'm 16 yo")).extracting(PersonalFactExtractor.Fact::statement)
                    .containsExactly("User is 16 years old");
        }

        @Test
        @DisplayName("should find nothing in a plain question")
        void noFacts() {
            assertThat(extractor.extract("How does photosynthesis work?")).isEmpty();
            assertThat(extractor.extract(null)).isEmpty();
        }
    }

    @Test
    @DisplayName("should read facts back out of stored statements, first text winning per tag")
    void factsFromStatements() {
        Map<String, String> facts = extractor.facts(List.of(
                "User's name is Kunal", "User lives in Pune", "User's name is Someone"));

        assertThat(facts).containsExactly(Map.entry("name", "Kunal"), Map.entry("location", "Pune"));
    }

    @Test
    @DisplayName("should derive tags from the words of a personal query")
    void queryTags() {
        assertThat(extractor.queryTags("What is my name?")).contains("name");
        assertThat(extractor.queryTags("How old am I?")).contains("age");
        assertThat(extractor.queryTags("Which city do I live in?")).contains("location");
        assertThat(extractor.queryTags("Who am I?")).containsExactly("name");
    }
}
