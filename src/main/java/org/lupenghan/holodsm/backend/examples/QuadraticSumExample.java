package org.lupenghan.holodsm.backend.examples;

import org.lupenghan.holodsm.backend.DSMSystem;
import org.lupenghan.holodsm.backend.DistributedArray;
import org.lupenghan.holodsm.backend.conf.DSMConfig;
import org.lupenghan.holodsm.backend.transport.Impl.InMemoryNetwork;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 二次函数求和示例
 * 两个节点各自填充一半数组 v*v + 3v + 1 并同步，第三个节点读取全部元素求和
 */
public class QuadraticSumExample {
    public static void main(String[] args) throws Exception {
        long length = args.length > 0 ? Long.parseLong(args[0]) : 20_000;

        DSMConfig config = DSMConfig.load("dsm.properties");
        InMemoryNetwork network = new InMemoryNetwork();
        DSMSystem home = new DSMSystem(config, network.join("node-a"));
        DSMSystem worker = new DSMSystem(config, network.join("node-b"));
        DSMSystem reader = new DSMSystem(config, network.join("node-c"));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            long start = System.currentTimeMillis();
            DistributedArray created = home.createArray(length);
            System.out.println("创建数组 " + created.getId() + "，共 " + created.getArray().getNumPages()
                    + " 页，耗时 " + (System.currentTimeMillis() - start) + "ms");

            // 按页边界切分，两个写者不会争用同一页的写租约
            long perPage = created.getArray().elementsPerPage();
            long split = Math.min(length, (created.getArray().getNumPages() / 2) * perPage);

            start = System.currentTimeMillis();
            List<Future<Void>> tasks = new ArrayList<>();
            tasks.add(pool.submit(() -> {
                fill(created, 0, split);
                return null;
            }));
            DistributedArray opened = worker.openArray(created.getId());
            tasks.add(pool.submit(() -> {
                fill(opened, split, length);
                return null;
            }));
            for (Future<Void> task : tasks) {
                task.get();
            }
            System.out.println("填充并同步完成，耗时 " + (System.currentTimeMillis() - start) + "ms");

            start = System.currentTimeMillis();
            DistributedArray view = reader.openArray(created.getId());
            long sum = 0;
            for (long i = 0; i < view.length(); i++) {
                sum += view.getLong(i);
            }
            System.out.println("求和完成，耗时 " + (System.currentTimeMillis() - start) + "ms");
            System.out.println("Sum: " + sum + "，期望 " + expectedSum(length));

            view.close();
            opened.close();
            created.close();
        } finally {
            pool.shutdown();
            reader.close();
            worker.close();
            home.close();
        }
    }

    private static void fill(DistributedArray array, long begin, long end) throws Exception {
        for (long i = begin; i < end; i++) {
            array.setLong(i, i * i + 3 * i + 1);
        }
        array.sync();
    }

    /**
     * 求和公式：sum(i^2) + 3*sum(i) + n
     */
    private static long expectedSum(long n) {
        long squares = (n - 1) * n * (2 * n - 1) / 6;
        long linear = (n - 1) * n / 2;
        return squares + 3 * linear + n;
    }
}
