package org.theseed.repgen.groups;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.theseed.repgen.RepGenomeException;
import org.theseed.repgen.RepGenomeIndex;
import org.theseed.repgen.TestRepGenomeIndex;
import org.theseed.repgen.sequence.Sequence;

/**
 * Tests for represented groups and common roles.
 */
public class TestRepresentedGroups {

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private static final String PROT_A = TestRepGenomeIndex.PROT_A;
    private static final String PROT_B = TestRepGenomeIndex.PROT_B;

    /**
     * @return an index containing genomes A and B
     *
     * @throws RepGenomeException
     */
    private static RepGenomeIndex buildIndex() throws RepGenomeException {
        RepGenomeIndex retVal = new RepGenomeIndex(8, 100);
        retVal.insert("100.1", "genome A", PROT_A);
        retVal.insert("200.2", "genome B", PROT_B);
        return retVal;
    }

    @Test
    public void testBuildGroups() throws RepGenomeException {
        RepGenomeIndex index = buildIndex();
        int selfB = index.get("200.2").getKmers().size();
        List<Sequence> queries = Arrays.asList(
                new Sequence("fig|500.5.peg.1", "both groups", PROT_A),
                new Sequence("600.6", "B only", PROT_B.substring(0, 150)),
                new Sequence("700.7", "nowhere", "WWWWWWWWWWCCCCCCCCCCWWWWWWWWWW"),
                new Sequence("800.8", "too short", "MKTAY"));
        RepresentedGroupBuilder builder = new RepresentedGroupBuilder(2);
        Map<String, RepresentedGroup> groups = builder.buildGroups(index, queries, 120);
        assertEquals(Arrays.asList("100.1", "200.2"), new ArrayList<String>(groups.keySet()));
        RepresentedGroup groupA = groups.get("100.1");
        RepresentedGroup groupB = groups.get("200.2");
        assertEquals(1, groupA.size());
        assertTrue(groupA.contains("500.5"));
        assertEquals(2, groupB.size());
        assertTrue(groupB.contains("500.5"));
        assertEquals(index.get("200.2").similarity(index.kmersOf(PROT_B.substring(0, 150))),
                groupB.getScore("600.6"));
        assertFalse(groupB.contains("700.7"));
        assertEquals(1, builder.getMultiCount());
        assertEquals(1, builder.getUnrepCount());
        assertEquals(1, builder.getEmptyCount());
        assertFalse(builder.isUsable(groupA));
        assertTrue(builder.isUsable(groupB));
        // A high enough score breaks up the multiple membership.  Groups without members are omitted.
        groups = builder.buildGroups(index, queries, selfB);
        assertEquals(Arrays.asList("100.1"), new ArrayList<String>(groups.keySet()));
        assertTrue(groups.get("100.1").contains("500.5"));
        assertEquals(0, builder.getMultiCount());
        assertEquals(2, builder.getUnrepCount());
    }

    @Test
    public void testQueryGenomeIds() throws RepGenomeException {
        RepGenomeIndex index = buildIndex();
        List<Sequence> queries = Arrays.asList(
                new Sequence("pheS", "500.5 Escherichia coli", PROT_A),
                new Sequence("fig|600.6.peg.12", "700.7", PROT_A),
                new Sequence("marker", "Escherichia coli", PROT_A));
        Map<String, RepresentedGroup> groups = new RepresentedGroupBuilder().buildGroups(index, queries, 300);
        RepresentedGroup groupA = groups.get("100.1");
        assertEquals(Arrays.asList("500.5", "600.6", "marker"), new ArrayList<String>(groupA.getMembers().keySet()));
    }

    @Test
    public void testConnectedGroups() throws RepGenomeException {
        RepGenomeIndex index = buildIndex();
        index.connect("100.1", "300.3", 150);
        index.connect("100.1", "400.4", 50);
        index.connect("200.2", "500.5", 100);
        Map<String, RepresentedGroup> groups = new RepresentedGroupBuilder().connectedGroups(index);
        assertEquals(2, groups.size());
        RepresentedGroup groupA = groups.get("100.1");
        assertEquals(2, groupA.size());
        assertTrue(groupA.contains("100.1"));
        assertTrue(groupA.contains("300.3"));
        assertFalse(groupA.contains("400.4"));
        assertEquals(150, groupA.getScore("300.3"));
        assertEquals(2, groups.get("200.2").size());
        assertTrue(groups.get("200.2").contains("500.5"));
        try {
            groupA.add("900.9", 99);
            fail("Low-scoring member added.");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testCommonRoles() throws Exception {
        RepGenomeIndex index = buildIndex();
        RepresentedGroup group = new RepresentedGroup(index.get("100.1"), 100);
        for (String genomeId : new String[] { "1.1", "2.2", "3.3", "4.4" })
            group.add(genomeId, 200);
        File roleFile = new File(this.tempFolder.getRoot(), "roles.tbl");
        FileUtils.writeStringToFile(roleFile, "1.1\tR1\n1.1\tR2\n1.1\tR3\n2.2\tR1\t1\n2.2\tR2\t1\n"
                + "3.3\tR1\n3.3\tR3\t2\n3.3\tR4\t0\nbadline\n", StandardCharsets.UTF_8);
        RoleCountTable roles = RoleCountTable.load(roleFile);
        assertEquals(3, roles.size());
        assertFalse(roles.contains("4.4"));
        assertEquals(2, roles.getCount("3.3", "R3"));
        assertEquals(0, roles.getCount("2.2", "R3"));
        RepresentedGroupBuilder builder = new RepresentedGroupBuilder(4);
        // Genome 4.4 has no role data, so it lacks every role but still counts as a member.
        Set<String> common = builder.commonRoles(group, roles, 100.0);
        assertTrue(common.isEmpty());
        // 60% of 4 is 2.4, which rounds up to 3.
        common = builder.commonRoles(group, roles, 60.0);
        assertEquals(Arrays.asList("R1"), new ArrayList<String>(common));
        common = builder.commonRoles(group, roles, 50.0);
        assertEquals(Arrays.asList("R1", "R2", "R3"), new ArrayList<String>(common));
        builder.setSingletonsOnly(true);
        common = builder.commonRoles(group, roles, 50.0);
        assertEquals(Arrays.asList("R1", "R2"), new ArrayList<String>(common));
        // Small groups produce no roles.
        RepresentedGroupBuilder strict = new RepresentedGroupBuilder(5);
        assertFalse(strict.isUsable(group));
        assertTrue(strict.commonRoles(group, roles, 50.0).isEmpty());
    }

    @Test
    public void testMissingRoleData() throws RepGenomeException {
        RepGenomeIndex index = buildIndex();
        RepresentedGroup group = new RepresentedGroup(index.get("100.1"), 100);
        RoleCountTable roles = new RoleCountTable();
        for (int i = 1; i <= 100; i++) {
            String genomeId = i + ".1";
            group.add(genomeId, 200);
            if (i < 100)
                roles.count(genomeId, "R1", 1);
        }
        RepresentedGroupBuilder builder = new RepresentedGroupBuilder();
        assertTrue(builder.isUsable(group));
        // 99 of the 100 members have the role.
        assertTrue(builder.commonRoles(group, roles, 100.0).isEmpty());
        assertEquals(Arrays.asList("R1"), new ArrayList<String>(builder.commonRoles(group, roles, 99.0)));
    }

    @Test
    public void testBadRoleCount() throws IOException {
        File roleFile = new File(this.tempFolder.getRoot(), "bad.tbl");
        FileUtils.writeStringToFile(roleFile, "1.1\tR1\tmany\n", StandardCharsets.UTF_8);
        try {
            RoleCountTable.load(roleFile);
            fail("Invalid role count accepted.");
        } catch (IOException e) {
            // expected
        }
    }

}
