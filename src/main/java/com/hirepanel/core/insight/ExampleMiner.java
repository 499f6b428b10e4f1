package com.hirepanel.core.insight;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds concrete evidence in reasoning text: money amounts, percentages, counted
 * quantities and well-known organization names, in that order.
 */
public final class ExampleMiner {

    static final int MAX_PER_BLOCK = 3;

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(?:\\bCAD?\\s*)?\\$[\\d.,]*\\d[MBK]?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\d+(\\.\\d+)?%"),
            Pattern.compile("\\b\\d{1,3}[,\\d]*\\+?\\s*(?:users|engineers|artists|deployments|companies|years)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:Meta|Google|Apple|Microsoft|Amazon|Spotify|Airbnb|Netflix|Tesla|Uber|LinkedIn"
                    + "|Twitter|Facebook|Instagram|WhatsApp|YouTube|TikTok|Snapchat|Pinterest|Reddit|Slack|Zoom"
                    + "|Shopify|Square|PayPal|Stripe|Salesforce|Oracle|SAP|Adobe|IBM|Intel|NVIDIA|AMD|Qualcomm"
                    + "|Cisco|VMware|ServiceNow|Workday|Atlassian|MongoDB|Snowflake|Datadog|Splunk|CrowdStrike"
                    + "|Okta|Twilio|SendGrid|Mailchimp|HubSpot|Zendesk|Freshworks|Canva|Figma|Notion|Airtable"
                    + "|Asana|Trello|Monday|GitLab|GitHub|BitBucket|Jenkins|Docker|Kubernetes|AWS|Azure|GCP"
                    + "|Heroku|Vercel|Netlify|CloudFlare|DigitalOcean|Linode|Vultr)\\b",
                    Pattern.CASE_INSENSITIVE));

    private ExampleMiner() {}

    /**
     * @return at most {@value #MAX_PER_BLOCK} matches from one reasoning block
     */
    public static List<String> mine(String reasoning) {
        var examples = new ArrayList<String>();
        if (reasoning == null || reasoning.isBlank()) {
            return examples;
        }
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(reasoning);
            while (matcher.find()) {
                examples.add(matcher.group().trim());
                if (examples.size() == MAX_PER_BLOCK) {
                    return examples;
                }
            }
        }
        return examples;
    }
}
