package com.parallel.dnamatch;

import com.parallel.dnamatch.engine.SearchResult;
import com.parallel.dnamatch.engine.Sequence;
import org.jocl.CL;
import org.jocl.CLException;
import org.jocl.Pointer;
import org.jocl.Sizeof;
import org.jocl.cl_command_queue;
import org.jocl.cl_context;
import org.jocl.cl_context_properties;
import org.jocl.cl_device_id;
import org.jocl.cl_kernel;
import org.jocl.cl_mem;
import org.jocl.cl_platform_id;
import org.jocl.cl_program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.jocl.CL.CL_CONTEXT_PLATFORM;
import static org.jocl.CL.CL_DEVICE_NAME;
import static org.jocl.CL.CL_DEVICE_TYPE_ACCELERATOR;
import static org.jocl.CL.CL_DEVICE_TYPE_CPU;
import static org.jocl.CL.CL_DEVICE_TYPE_GPU;
import static org.jocl.CL.CL_MEM_COPY_HOST_PTR;
import static org.jocl.CL.CL_MEM_READ_ONLY;
import static org.jocl.CL.CL_MEM_WRITE_ONLY;
import static org.jocl.CL.CL_PROGRAM_BUILD_LOG;
import static org.jocl.CL.clBuildProgram;
import static org.jocl.CL.clCreateBuffer;
import static org.jocl.CL.clCreateCommandQueue;
import static org.jocl.CL.clCreateContext;
import static org.jocl.CL.clCreateKernel;
import static org.jocl.CL.clCreateProgramWithSource;
import static org.jocl.CL.clEnqueueNDRangeKernel;
import static org.jocl.CL.clEnqueueReadBuffer;
import static org.jocl.CL.clFinish;
import static org.jocl.CL.clGetDeviceIDs;
import static org.jocl.CL.clGetDeviceInfo;
import static org.jocl.CL.clGetPlatformIDs;
import static org.jocl.CL.clGetProgramBuildInfo;
import static org.jocl.CL.clReleaseMemObject;
import static org.jocl.CL.clSetKernelArg;

/**
 * Parallel search using OpenCL through JOCL: one work-item scores one offset, the host keeps the best.
 * Falls back to an accelerator or a CPU OpenCL device when no GPU is present.
 */
public class ParallelGpuSearcher implements BestMatchSearcher {

    private static final Logger log = LoggerFactory.getLogger(ParallelGpuSearcher.class);

    /**
     * Compiled program per device, so repeated runs skip the build.
     */
    private static final Map<String, CachedResources> CACHE = new ConcurrentHashMap<>();

    private static final String KERNEL_SOURCE = """
            __kernel void scoreOffsets(__global const uchar* subject,
                                       const int subjectLen,
                                       __global const uchar* pattern,
                                       const int patternLen,
                                       __global int* scores) {
                int offset = get_global_id(0);
                if (offset >= subjectLen) {
                    return;
                }
                int limit = min(patternLen, subjectLen - offset);
                int matches = 0;
                for (int j = 0; j < limit; j++) {
                    if (subject[offset + j] == pattern[j]) {
                        matches++;
                    }
                }
                scores[offset] = matches;
            }
            """;

    @Override
    public String name() {
        return "ParallelGPU";
    }

    @Override
    public MatchReport search(String datasetName, Sequence subject, Sequence pattern) {
        if (subject.isEmpty() || pattern.isEmpty()) {
            throw new IllegalArgumentException("Subject and pattern must not be empty");
        }
        CL.setExceptionsEnabled(true);

        OpenClDevice device = selectDevice();
        long start = System.nanoTime();
        int[] scores = runKernel(device, subject.toByteArray(), pattern.toByteArray());
        SearchResult best = bestOf(scores);
        long elapsed = System.nanoTime() - start;
        String deviceLabel = device.typeLabel() + " (" + device.name() + ")";
        return new MatchReport(name(), datasetName, best.position(), best.count(), elapsed / 1_000_000,
                null, deviceLabel);
    }

    /**
     * Scans scores in offset order keeping strictly better counts, so ties resolve to the lowest offset.
     */
    static SearchResult bestOf(int[] scores) {
        SearchResult best = SearchResult.NONE;
        for (int offset = 0; offset < scores.length; offset++) {
            if (scores[offset] > best.count()) {
                best = new SearchResult(offset, scores[offset]);
            }
        }
        return best;
    }

    private int[] runKernel(OpenClDevice device, byte[] subjectBytes, byte[] patternBytes) {
        CachedResources resources = CACHE.computeIfAbsent(device.name(), k -> buildResources(device));
        cl_context context = resources.context();
        cl_command_queue queue = resources.queue();
        cl_kernel kernel = resources.kernel();

        cl_mem subjectMem = clCreateBuffer(context, CL_MEM_READ_ONLY | CL_MEM_COPY_HOST_PTR,
                (long) Sizeof.cl_char * subjectBytes.length, Pointer.to(subjectBytes), null);
        cl_mem patternMem = clCreateBuffer(context, CL_MEM_READ_ONLY | CL_MEM_COPY_HOST_PTR,
                (long) Sizeof.cl_char * patternBytes.length, Pointer.to(patternBytes), null);
        cl_mem scoresMem = clCreateBuffer(context, CL_MEM_WRITE_ONLY,
                (long) Sizeof.cl_int * subjectBytes.length, null, null);

        int[] scores = new int[subjectBytes.length];
        try {
            // kernel arguments are per-kernel state; the cached kernel is shared between callers
            synchronized (kernel) {
                clSetKernelArg(kernel, 0, Sizeof.cl_mem, Pointer.to(subjectMem));
                clSetKernelArg(kernel, 1, Sizeof.cl_int, Pointer.to(new int[]{subjectBytes.length}));
                clSetKernelArg(kernel, 2, Sizeof.cl_mem, Pointer.to(patternMem));
                clSetKernelArg(kernel, 3, Sizeof.cl_int, Pointer.to(new int[]{patternBytes.length}));
                clSetKernelArg(kernel, 4, Sizeof.cl_mem, Pointer.to(scoresMem));

                long[] globalWorkSize = new long[]{subjectBytes.length};
                clEnqueueNDRangeKernel(queue, kernel, 1, null, globalWorkSize, null, 0, null, null);
                clFinish(queue);
            }
            clEnqueueReadBuffer(queue, scoresMem, CL.CL_TRUE, 0, (long) Sizeof.cl_int * scores.length,
                    Pointer.to(scores), 0, null, null);
        } finally {
            clReleaseMemObject(subjectMem);
            clReleaseMemObject(patternMem);
            clReleaseMemObject(scoresMem);
        }
        return scores;
    }

    private CachedResources buildResources(OpenClDevice device) {
        log.debug("Building OpenCL program for {}", device.name());
        cl_context_properties contextProperties = new cl_context_properties();
        contextProperties.addProperty(CL_CONTEXT_PLATFORM, device.platform());
        cl_context context = clCreateContext(
                contextProperties, 1, new cl_device_id[]{device.id()}, null, null, null);

        cl_command_queue queue = clCreateCommandQueue(context, device.id(), 0, null);

        cl_program program = clCreateProgramWithSource(context, 1, new String[]{KERNEL_SOURCE}, null, null);
        int buildResult = clBuildProgram(program, 0, null, null, null, null);
        if (buildResult != CL.CL_SUCCESS) {
            throw new IllegalStateException("OpenCL program build failed: " + buildLog(program, device.id()));
        }
        cl_kernel kernel = clCreateKernel(program, "scoreOffsets", null);
        return new CachedResources(context, queue, program, kernel);
    }

    private String buildLog(cl_program program, cl_device_id device) {
        long[] logSize = new long[1];
        clGetProgramBuildInfo(program, device, CL_PROGRAM_BUILD_LOG, 0, null, logSize);
        byte[] logData = new byte[(int) logSize[0]];
        clGetProgramBuildInfo(program, device, CL_PROGRAM_BUILD_LOG, logSize[0], Pointer.to(logData), null);
        return new String(logData, StandardCharsets.UTF_8);
    }

    private OpenClDevice selectDevice() {
        int[] numPlatformsArr = new int[1];
        clGetPlatformIDs(0, null, numPlatformsArr);
        if (numPlatformsArr[0] == 0) {
            throw new IllegalStateException("No OpenCL platforms found. Install GPU/CPU OpenCL drivers.");
        }
        cl_platform_id[] platforms = new cl_platform_id[numPlatformsArr[0]];
        clGetPlatformIDs(platforms.length, platforms, null);

        List<OpenClDevice> devices = new ArrayList<>();
        long[] preference = {CL_DEVICE_TYPE_GPU, CL_DEVICE_TYPE_ACCELERATOR, CL_DEVICE_TYPE_CPU};
        String[] labels = {"GPU", "Accelerator", "CPU"};
        for (int i = 0; i < preference.length && devices.isEmpty(); i++) {
            for (cl_platform_id platform : platforms) {
                collectDevices(platform, preference[i], labels[i], devices);
            }
        }
        if (devices.isEmpty()) {
            throw new IllegalStateException("No suitable OpenCL devices available.");
        }
        return devices.get(0);
    }

    private void collectDevices(cl_platform_id platform, long type, String label, List<OpenClDevice> devices) {
        int[] numDevicesArr = new int[1];
        int res;
        try {
            res = clGetDeviceIDs(platform, type, 0, null, numDevicesArr);
        } catch (CLException e) {
            // CL_DEVICE_NOT_FOUND surfaces as an exception once exceptions are enabled
            log.debug("No {} devices on platform: {}", label, e.getMessage());
            return;
        }
        if (res != CL.CL_SUCCESS || numDevicesArr[0] == 0) {
            return;
        }
        cl_device_id[] ids = new cl_device_id[numDevicesArr[0]];
        clGetDeviceIDs(platform, type, ids.length, ids, null);
        for (cl_device_id id : ids) {
            devices.add(new OpenClDevice(platform, id, label, deviceName(id)));
        }
    }

    private String deviceName(cl_device_id deviceId) {
        long[] size = new long[1];
        clGetDeviceInfo(deviceId, CL_DEVICE_NAME, 0, null, size);
        byte[] data = new byte[(int) size[0]];
        clGetDeviceInfo(deviceId, CL_DEVICE_NAME, size[0], Pointer.to(data), null);
        return new String(data, StandardCharsets.UTF_8).trim();
    }

    private record OpenClDevice(cl_platform_id platform, cl_device_id id, String typeLabel, String name) {
    }

    private record CachedResources(cl_context context, cl_command_queue queue, cl_program program, cl_kernel kernel) {
    }
}
