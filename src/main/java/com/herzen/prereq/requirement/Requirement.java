package com.herzen.prereq.requirement;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Requirement.None.class, name = "NONE"),
        @JsonSubTypes.Type(value = Requirement.Single.class, name = "SINGLE"),
        @JsonSubTypes.Type(value = Requirement.All.class, name = "ALL"),
        @JsonSubTypes.Type(value = Requirement.Any.class, name = "ANY"),
        @JsonSubTypes.Type(value = Requirement.Grade.class, name = "GRADE"),
        @JsonSubTypes.Type(value = Requirement.FreeText.class, name = "FREE_TEXT"),
        @JsonSubTypes.Type(value = Requirement.CreditCount.class, name = "CREDIT_COUNT")
})
public interface Requirement {

    @JsonIgnore
    default boolean isMeaningful() {
        return !(this instanceof None) && !(this instanceof FreeText);
    }

    default List<String> referencedCourses() {
        Set<String> names = new LinkedHashSet<>();
        collectCourses(this, names);
        return List.copyOf(names);
    }

    private static void collectCourses(Requirement req, Set<String> names) {
        if (req instanceof Single single) {
            names.add(single.courseName());
        } else if (req instanceof All all) {
            all.children().forEach(child -> collectCourses(child, names));
        } else if (req instanceof Any any) {
            any.children().forEach(child -> collectCourses(child, names));
        } else if (req instanceof Grade grade) {
            collectCourses(grade.inner(), names);
        } else if (req instanceof CreditCount credits) {
            collectCourses(credits.inner(), names);
        }
    }

    static Requirement none() {
        return new None();
    }

    static Requirement course(String courseName) {
        return new Single(courseName, "");
    }

    static Requirement all(Requirement... children) {
        return new All(List.of(children));
    }

    static Requirement any(Requirement... children) {
        return new Any(List.of(children));
    }

    record None() implements Requirement {}

    record Single(String courseName, String grade) implements Requirement {
        public Single {
            if (courseName == null || courseName.isBlank()) {
                throw new IllegalArgumentException("SINGLE requirement needs a courseName");
            }
            grade = grade == null ? "" : grade;
        }
    }

    record All(List<Requirement> children) implements Requirement {
        public All {
            children = children == null ? List.of() : List.copyOf(children);
        }
    }

    record Any(List<Requirement> children) implements Requirement {
        public Any {
            children = children == null ? List.of() : List.copyOf(children);
        }
    }

    record Grade(String description, Requirement inner) implements Requirement {
        public Grade {
            inner = inner == null ? new None() : inner;
        }
    }

    record FreeText(String text) implements Requirement {
        public FreeText {
            text = text == null ? "" : text;
        }
    }

    record CreditCount(String amount, Requirement inner) implements Requirement {
        public CreditCount {
            inner = inner == null ? new None() : inner;
        }
    }
}
