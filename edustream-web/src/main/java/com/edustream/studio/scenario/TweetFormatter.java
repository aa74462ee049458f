package com.edustream.studio.scenario;

@FunctionalInterface
public interface TweetFormatter {
    String format(Params params, Solution solution, EngagementFormat format);
}
